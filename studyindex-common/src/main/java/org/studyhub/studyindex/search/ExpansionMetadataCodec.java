package org.studyhub.studyindex.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the acronym/synonym maps kept as JSON strings in flat document metadata.
 *
 * <p>The store only holds scalar metadata, so the maps travel serialized and are decoded
 * only for query expansion. Writes are bounded: entries are dropped from the end until
 * the JSON fits {@code maxSerializedLength}.</p>
 */
@Slf4j
public class ExpansionMetadataCodec {

    public static final String ACRONYMS_KEY = "acronyms";
    public static final String SYNONYMS_KEY = "synonyms";

    public static final int DEFAULT_MAX_SERIALIZED_LENGTH = 2000;

    private final ObjectMapper objectMapper;
    private final int maxSerializedLength;

    public ExpansionMetadataCodec(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_MAX_SERIALIZED_LENGTH);
    }

    public ExpansionMetadataCodec(ObjectMapper objectMapper, int maxSerializedLength) {
        if (maxSerializedLength < 2) {
            throw new IllegalArgumentException("maxSerializedLength must hold at least '{}'");
        }
        this.objectMapper = objectMapper;
        this.maxSerializedLength = maxSerializedLength;
    }

    public String encodeAcronyms(Map<String, String> acronyms) {
        return encodeBounded(acronyms, ACRONYMS_KEY);
    }

    public String encodeSynonyms(Map<String, List<String>> synonyms) {
        return encodeBounded(synonyms, SYNONYMS_KEY);
    }

    /**
     * @return {@code key -> expansion}; empty when the value is missing or malformed
     */
    public Map<String, String> decodeAcronyms(String json) {
        Map<String, String> acronyms = new LinkedHashMap<>();
        JsonNode root = parseObject(json, ACRONYMS_KEY);
        if (root == null) {
            return acronyms;
        }
        root.fields().forEachRemaining(entry -> {
            if (entry.getValue().isTextual() && !entry.getValue().asText().isBlank()) {
                acronyms.put(entry.getKey(), entry.getValue().asText());
            }
        });
        return acronyms;
    }

    /**
     * @return {@code key -> alternates}; a single string alternate is accepted as a one-element list
     */
    public Map<String, List<String>> decodeSynonyms(String json) {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        JsonNode root = parseObject(json, SYNONYMS_KEY);
        if (root == null) {
            return synonyms;
        }
        root.fields().forEachRemaining(entry -> {
            List<String> alternates = new ArrayList<>();
            JsonNode value = entry.getValue();
            if (value.isArray()) {
                value.forEach(item -> {
                    if (item.isTextual() && !item.asText().isBlank()) {
                        alternates.add(item.asText());
                    }
                });
            } else if (value.isTextual() && !value.asText().isBlank()) {
                alternates.add(value.asText());
            }
            if (!alternates.isEmpty()) {
                synonyms.put(entry.getKey(), alternates);
            }
        });
        return synonyms;
    }

    private JsonNode parseObject(String json, String field) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                log.debug("Ignoring non-object {} metadata: {}", field, json);
                return null;
            }
            return root;
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed {} metadata: {}", field, e.getOriginalMessage());
            return null;
        }
    }

    private <V> String encodeBounded(Map<String, V> map, String field) {
        if (map == null || map.isEmpty()) {
            return null;
        }
        Map<String, V> bounded = new LinkedHashMap<>(map);
        List<String> keys = new ArrayList<>(bounded.keySet());
        try {
            String json = objectMapper.writeValueAsString(bounded);
            int dropped = 0;
            while (json.length() > maxSerializedLength && !keys.isEmpty()) {
                bounded.remove(keys.remove(keys.size() - 1));
                dropped++;
                json = objectMapper.writeValueAsString(bounded);
            }
            if (dropped > 0) {
                log.warn("Dropped {} of {} {} entries to fit metadata bound of {} chars",
                        dropped, map.size(), field, maxSerializedLength);
            }
            return bounded.isEmpty() ? null : json;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + field + " metadata", e);
        }
    }
}

package org.studyhub.studyindex.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpansionMetadataCodecTest {

    private final ExpansionMetadataCodec codec = new ExpansionMetadataCodec(new ObjectMapper());

    @Test
    void decodesAcronymsAndSynonyms() {
        assertEquals(Map.of("oop", "object oriented programming"),
                codec.decodeAcronyms("{\"oop\":\"object oriented programming\"}"));
        assertEquals(Map.of("array", List.of("list", "vector"), "loop", List.of("iteration")),
                codec.decodeSynonyms("{\"array\":[\"list\",\"vector\"],\"loop\":\"iteration\"}"));
    }

    @Test
    void ignoresMissingOrMalformedJson() {
        assertTrue(codec.decodeAcronyms(null).isEmpty());
        assertTrue(codec.decodeAcronyms("not json").isEmpty());
        assertTrue(codec.decodeSynonyms("[\"array\"]").isEmpty());
        assertTrue(codec.decodeAcronyms("{\"oop\": 42}").isEmpty());
    }

    @Test
    void dropsTrailingEntriesToFitBound() {
        ExpansionMetadataCodec bounded = new ExpansionMetadataCodec(new ObjectMapper(), 40);
        Map<String, String> acronyms = new LinkedHashMap<>();
        acronyms.put("oop", "object oriented");
        acronyms.put("dsa", "data structures and algorithms");

        String json = bounded.encodeAcronyms(acronyms);

        assertEquals("{\"oop\":\"object oriented\"}", json);
        assertTrue(json.length() <= 40);
    }

    @Test
    void encodesNothingForEmptyMaps() {
        assertNull(codec.encodeAcronyms(Map.of()));
        assertNull(codec.encodeSynonyms(null));
    }
}

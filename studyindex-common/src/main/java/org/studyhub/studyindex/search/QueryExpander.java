package org.studyhub.studyindex.search;

import lombok.extern.slf4j.Slf4j;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.exception.EmbeddingException;
import org.studyhub.studyindex.exception.VectorStoreException;
import org.studyhub.studyindex.model.VectorQueryResult;
import org.studyhub.studyindex.service.EmbeddingProvider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Broadens jargon-heavy queries with acronym and synonym expansions.
 *
 * <p>The dictionaries are not static: they are read from the {@code acronyms}/{@code synonyms}
 * metadata of indexed entities. With a scope, the scoped entities are fetched by id from the
 * entity collection; without one, a small exploratory search over the content collection
 * supplies the metadata.</p>
 *
 * <p>Expansion is best effort. A store or embedding failure while gathering metadata yields
 * no expansion terms rather than a failed search.</p>
 */
@Slf4j
public class QueryExpander {

    private static final Pattern SEPARATORS = Pattern.compile("[-_]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^\\p{Punct}+|\\p{Punct}+$");

    private final VectorStoreClient vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final ExpansionMetadataCodec codec;
    private final String entityCollection;
    private final String contentCollection;

    public QueryExpander(VectorStoreClient vectorStore,
                         EmbeddingProvider embeddingProvider,
                         ExpansionMetadataCodec codec,
                         String entityCollection,
                         String contentCollection) {
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.codec = codec;
        this.entityCollection = entityCollection;
        this.contentCollection = contentCollection;
    }

    /**
     * Lower-cases, turns {@code -} and {@code _} into spaces and collapses whitespace.
     */
    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        String lowered = query.toLowerCase(Locale.ROOT);
        String spaced = SEPARATORS.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }

    /**
     * Expansion terms for {@code query}, excluding anything already in the query.
     *
     * @param scopeIds optional parent ids; {@code null} or empty means unscoped
     * @return terms in discovery order, at most {@link ExpansionTuning#maxTerms()}
     */
    public Set<String> expand(String query, Collection<String> scopeIds, ExpansionTuning tuning) {
        ExpansionTuning effective = tuning == null ? ExpansionTuning.defaults() : tuning;
        String normalized = normalize(query);
        if (!effective.enabled() || effective.maxTerms() == 0 || normalized.isEmpty()) {
            return Set.of();
        }

        List<Map<String, String>> metadatas = gatherMetadata(normalized, scopeIds, effective);
        if (metadatas.isEmpty()) {
            return Set.of();
        }

        Dictionary dictionary = buildDictionary(metadatas);
        Set<String> terms = expandWith(normalized, dictionary, effective.maxTerms());
        if (!terms.isEmpty()) {
            log.debug("Expanded \"{}\" with {}", normalized, terms);
        }
        return terms;
    }

    /**
     * Applies the forward and reverse lookups to an already normalized query.
     */
    static Set<String> expandWith(String normalizedQuery, Dictionary dictionary, int maxTerms) {
        List<String> tokens = tokens(normalizedQuery);
        Set<String> original = new LinkedHashSet<>(tokens);
        String phrase = String.join(" ", tokens);
        Set<String> candidates = new LinkedHashSet<>();

        for (String token : tokens) {
            String expansion = dictionary.acronyms().get(token);
            if (expansion != null) {
                candidates.add(expansion);
            }
            List<String> alternates = dictionary.synonyms().get(token);
            if (alternates != null) {
                candidates.addAll(alternates);
            }
        }

        // reverse lookups: a token (or a multi-word phrase of the query) that is itself an expansion
        String padded = " " + phrase + " ";
        dictionary.acronyms().forEach((key, expansion) -> {
            if (original.contains(expansion) || padded.contains(" " + expansion + " ")) {
                candidates.add(key);
            }
        });
        dictionary.synonyms().forEach((key, alternates) -> {
            for (String alternate : alternates) {
                if (original.contains(alternate) || padded.contains(" " + alternate + " ")) {
                    candidates.add(key);
                    break;
                }
            }
        });

        Set<String> terms = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (terms.size() >= maxTerms) {
                break;
            }
            if (!candidate.isEmpty() && !original.contains(candidate) && !candidate.equals(phrase)) {
                terms.add(candidate);
            }
        }
        return terms;
    }

    /**
     * Whitespace tokens of a normalized query with leading/trailing punctuation removed.
     */
    private static List<String> tokens(String normalizedQuery) {
        List<String> tokens = new ArrayList<>();
        for (String raw : normalizedQuery.split(" ")) {
            String token = EDGE_PUNCTUATION.matcher(raw).replaceAll("");
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private List<Map<String, String>> gatherMetadata(String normalized,
                                                     Collection<String> scopeIds,
                                                     ExpansionTuning tuning) {
        try {
            VectorQueryResult hits;
            if (scopeIds != null && !scopeIds.isEmpty()) {
                hits = vectorStore.getDocuments(entityCollection, List.copyOf(scopeIds));
            } else {
                List<Double> embedding = embeddingProvider.embed(normalized);
                if (embedding.isEmpty()) {
                    return List.of();
                }
                hits = vectorStore.search(contentCollection, embedding, tuning.explorationLimit(), 0, null);
            }
            return hits.metadatas();
        } catch (VectorStoreException | EmbeddingException e) {
            log.warn("Query expansion skipped, could not gather acronym metadata: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Merges every hit's maps; the first hit defining a key wins.
     */
    Dictionary buildDictionary(List<Map<String, String>> metadatas) {
        Map<String, String> acronyms = new LinkedHashMap<>();
        Map<String, List<String>> synonyms = new LinkedHashMap<>();

        for (Map<String, String> metadata : metadatas) {
            if (metadata == null) {
                continue;
            }
            codec.decodeAcronyms(metadata.get(ExpansionMetadataCodec.ACRONYMS_KEY)).forEach((key, value) -> {
                String k = normalize(key);
                String v = normalize(value);
                if (!k.isEmpty() && !v.isEmpty()) {
                    acronyms.putIfAbsent(k, v);
                }
            });
            codec.decodeSynonyms(metadata.get(ExpansionMetadataCodec.SYNONYMS_KEY)).forEach((key, values) -> {
                String k = normalize(key);
                if (k.isEmpty() || synonyms.containsKey(k)) {
                    return;
                }
                List<String> normalizedValues = new ArrayList<>(values.size());
                for (String value : values) {
                    String v = normalize(value);
                    if (!v.isEmpty()) {
                        normalizedValues.add(v);
                    }
                }
                if (!normalizedValues.isEmpty()) {
                    synonyms.put(k, List.copyOf(normalizedValues));
                }
            });
        }
        return new Dictionary(acronyms, synonyms);
    }

    /**
     * Aggregated acronym ({@code key -> expansion}) and synonym ({@code key -> alternates}) maps.
     */
    record Dictionary(Map<String, String> acronyms, Map<String, List<String>> synonyms) {
    }
}

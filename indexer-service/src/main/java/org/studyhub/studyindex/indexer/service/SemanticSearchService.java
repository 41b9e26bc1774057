package org.studyhub.studyindex.indexer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.exception.VectorStoreException;
import org.studyhub.studyindex.filter.Filter;
import org.studyhub.studyindex.model.SearchResult;
import org.studyhub.studyindex.search.ScoringPolicy;
import org.studyhub.studyindex.search.SearchRanker;
import org.studyhub.studyindex.service.EmbeddingProvider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared query path of the search endpoints.
 *
 * <p>Workflow:
 * <ol>
 *   <li>Build the query variants: the query itself, then {@code query + " " + term} per expansion term</li>
 *   <li>Embed each variant and run a filtered nearest-neighbour query against every collection</li>
 *   <li>Score the hits with the collection's {@link ScoringPolicy}</li>
 *   <li>Merge by id keeping the best score, drop results under {@code minScore}, truncate</li>
 * </ol>
 *
 * <p>A query that fails in the vector store only drops that variant's hits; when every query
 * fails the search answers with no matches. Embedding failures propagate.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticSearchService {

    private final VectorStoreClient vectorStoreClient;
    private final EmbeddingProvider embeddingProvider;
    private final SearchRanker searchRanker;

    public List<SearchResult> search(String collection,
                                     String query,
                                     Collection<String> expansionTerms,
                                     Filter filter,
                                     ScoringPolicy policy,
                                     int limit,
                                     double minScore) {
        return search(List.of(collection), query, expansionTerms, filter, policy, limit, minScore);
    }

    /**
     * Runs every query variant against each of {@code collections} and ranks all hits together.
     */
    public List<SearchResult> search(List<String> collections,
                                     String query,
                                     Collection<String> expansionTerms,
                                     Filter filter,
                                     ScoringPolicy policy,
                                     int limit,
                                     double minScore) {
        long startTime = System.currentTimeMillis();

        Set<String> variants = new LinkedHashSet<>();
        variants.add(query);
        if (expansionTerms != null) {
            for (String term : expansionTerms) {
                variants.add(query + " " + term);
            }
        }

        List<List<SearchResult>> resultSets = new ArrayList<>(variants.size() * collections.size());
        int failed = 0;
        for (String variant : variants) {
            List<Double> vector = embeddingProvider.embed(variant);
            if (vector.isEmpty()) {
                log.warn("Empty embedding vector for query variant: \"{}\"", variant);
                continue;
            }
            for (String collection : collections) {
                try {
                    resultSets.add(searchRanker.toResults(
                            vectorStoreClient.search(collection, vector, limit, 0, filter), policy));
                } catch (VectorStoreException e) {
                    failed++;
                    log.warn("Search in '{}' failed for query variant \"{}\", skipping [{}]: {}",
                            collection, variant, e.getCode().code(), e.getMessage());
                }
            }
        }

        List<SearchResult> ranked = searchRanker.rank(resultSets, minScore, limit);

        log.info("Search in {} completed: {} results from {} query variants ({} failed queries) in {}ms (minScore={})",
                collections, ranked.size(), variants.size(), failed, System.currentTimeMillis() - startTime, minScore);
        return ranked;
    }
}

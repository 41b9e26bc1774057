package org.studyhub.studyindex.search;

import lombok.extern.slf4j.Slf4j;
import org.studyhub.studyindex.model.ResultGroup;
import org.studyhub.studyindex.model.SearchResult;
import org.studyhub.studyindex.model.VectorQueryResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw store hits into one deduplicated, score-sorted list.
 *
 * <p>Result sets from several queries (original plus expansions) or several collections
 * are merged by document id, keeping the best score per id. Scores below
 * {@link #SCORE_FLOOR} are dropped as degenerate; meaningful thresholds are the caller's.</p>
 */
@Slf4j
public class SearchRanker {

    public static final double SCORE_FLOOR = 1e-5d;

    private static final Comparator<SearchResult> BY_SCORE_DESC = Comparator
            .comparingDouble(SearchResult::getRelevanceScore).reversed()
            .thenComparing(SearchResult::getId);

    /**
     * Scores every hit of {@code raw} under {@code policy}. Hits without a distance are skipped.
     */
    public List<SearchResult> toResults(VectorQueryResult raw, ScoringPolicy policy) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<SearchResult> results = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            Double distance = raw.distance(i);
            if (distance == null) {
                continue;
            }
            results.add(SearchResult.builder()
                    .id(raw.ids().get(i))
                    .content(raw.document(i))
                    .metadata(raw.metadata(i))
                    .relevanceScore(policy.score(distance))
                    .build());
        }
        return results;
    }

    /**
     * Merges result sets: one entry per id with the maximum score, floor applied,
     * sorted by score descending and truncated to {@code limit}.
     */
    public List<SearchResult> merge(Collection<List<SearchResult>> resultSets, int limit) {
        return rank(resultSets, 0.0d, limit);
    }

    /**
     * Same as {@link #merge} but also drops results scoring below {@code minScore}
     * before truncating.
     */
    public List<SearchResult> rank(Collection<List<SearchResult>> resultSets, double minScore, int limit) {
        if (resultSets == null || resultSets.isEmpty() || limit <= 0) {
            return List.of();
        }

        Map<String, SearchResult> best = new LinkedHashMap<>();
        for (List<SearchResult> results : resultSets) {
            if (results == null) {
                continue;
            }
            for (SearchResult result : results) {
                if (result == null || result.getId() == null) {
                    continue;
                }
                best.merge(result.getId(), result,
                        (current, candidate) -> candidate.getRelevanceScore() > current.getRelevanceScore()
                                ? candidate : current);
            }
        }

        double threshold = Math.max(minScore, SCORE_FLOOR);
        List<SearchResult> ranked = best.values().stream()
                .filter(r -> r.getRelevanceScore() >= threshold)
                .sorted(BY_SCORE_DESC)
                .limit(limit)
                .toList();

        log.debug("Ranked {} distinct hits into {} results (minScore={}, limit={})",
                best.size(), ranked.size(), minScore, limit);
        return ranked;
    }

    /**
     * Groups results by the metadata value under {@code parentKey}. Groups are ranked by
     * their best child; children stay sorted by score. Results without the key form
     * singleton groups keyed by their own id.
     */
    public List<ResultGroup> group(List<SearchResult> results, String parentKey, int limit) {
        if (results == null || results.isEmpty() || limit <= 0) {
            return List.of();
        }

        Map<String, List<SearchResult>> byParent = new LinkedHashMap<>();
        for (SearchResult result : results) {
            String parent = result.metadataValue(parentKey);
            if (parent == null || parent.isBlank()) {
                parent = result.getId();
            }
            byParent.computeIfAbsent(parent, k -> new ArrayList<>()).add(result);
        }

        List<ResultGroup> groups = new ArrayList<>(byParent.size());
        byParent.forEach((parent, children) -> {
            List<SearchResult> sorted = children.stream().sorted(BY_SCORE_DESC).toList();
            groups.add(new ResultGroup(parent, sorted.get(0).getRelevanceScore(), sorted));
        });

        return groups.stream()
                .sorted(Comparator.comparingDouble(ResultGroup::score).reversed()
                        .thenComparing(ResultGroup::parentId))
                .limit(limit)
                .toList();
    }
}

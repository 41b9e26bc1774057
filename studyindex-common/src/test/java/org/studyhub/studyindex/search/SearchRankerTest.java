package org.studyhub.studyindex.search;

import org.junit.jupiter.api.Test;
import org.studyhub.studyindex.model.ResultGroup;
import org.studyhub.studyindex.model.SearchResult;
import org.studyhub.studyindex.model.VectorQueryResult;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchRankerTest {

    private final SearchRanker ranker = new SearchRanker();

    @Test
    void mergeKeepsMaximumScorePerId() {
        List<SearchResult> original = List.of(result("CS101_L1_0", 0.42), result("CS101_L2_0", 0.30));
        List<SearchResult> expanded = List.of(result("CS101_L1_0", 0.77));

        List<SearchResult> merged = ranker.merge(List.of(original, expanded), 10);

        assertEquals(2, merged.size());
        assertEquals("CS101_L1_0", merged.get(0).getId());
        assertEquals(0.77, merged.get(0).getRelevanceScore(), 1e-12);
    }

    @Test
    void mergeSortsDescendingAndTruncates() {
        List<SearchResult> merged = ranker.merge(List.of(List.of(
                result("a", 0.2), result("b", 0.9), result("c", 0.5), result("d", 0.7))), 3);

        assertEquals(List.of("b", "d", "c"), merged.stream().map(SearchResult::getId).toList());
    }

    @Test
    void mergeDropsDegenerateScoresOnly() {
        List<SearchResult> merged = ranker.merge(List.of(List.of(
                result("tiny", 1e-6), result("small", 0.001))), 10);

        assertEquals(List.of("small"), merged.stream().map(SearchResult::getId).toList());
    }

    @Test
    void rankAppliesCallerMinScoreBeforeLimit() {
        List<SearchResult> ranked = ranker.rank(List.of(List.of(
                result("a", 0.9), result("b", 0.4), result("c", 0.6))), 0.5, 1);

        assertEquals(List.of("a"), ranked.stream().map(SearchResult::getId).toList());
        assertTrue(ranker.rank(List.of(List.of(result("a", 0.3))), 0.5, 5).isEmpty());
    }

    @Test
    void convertsRawDistancesUnderTheGivenPolicy() {
        VectorQueryResult raw = new VectorQueryResult(
                List.of("x", "y"),
                List.of("text x", "text y"),
                List.of(Map.of("course_id", "CS101"), Map.of()),
                Arrays.asList(0.25, 1.5));

        List<SearchResult> tail = ranker.toResults(raw, ScoringPolicy.EXPONENTIAL_TAIL);
        List<SearchResult> linear = ranker.toResults(raw, ScoringPolicy.LINEAR_CLAMP);

        assertEquals(0.75, tail.get(0).getRelevanceScore(), 1e-12);
        assertEquals(Math.exp(-1.5), tail.get(1).getRelevanceScore(), 1e-12);
        assertEquals(0.0, linear.get(1).getRelevanceScore(), 1e-12);
        assertEquals("CS101", tail.get(0).metadataValue("course_id"));
    }

    @Test
    void groupsByParentRankedByBestChild() {
        List<SearchResult> results = List.of(
                result("CS101", 0.5, "CS101"),
                result("CS101_L1_0", 0.8, "CS101"),
                result("MA201_L3_2", 0.9, "MA201"),
                result("orphan", 0.1, null));

        List<ResultGroup> groups = ranker.group(results, "course_id", 10);

        assertEquals(List.of("MA201", "CS101", "orphan"), groups.stream().map(ResultGroup::parentId).toList());
        ResultGroup cs101 = groups.get(1);
        assertEquals(0.8, cs101.score(), 1e-12);
        assertEquals(List.of("CS101_L1_0", "CS101"), cs101.children().stream().map(SearchResult::getId).toList());
    }

    private static SearchResult result(String id, double score) {
        return result(id, score, null);
    }

    private static SearchResult result(String id, double score, String courseId) {
        return SearchResult.builder()
                .id(id)
                .content("content of " + id)
                .metadata(courseId == null ? Map.of() : Map.of("course_id", courseId))
                .relevanceScore(score)
                .build();
    }
}

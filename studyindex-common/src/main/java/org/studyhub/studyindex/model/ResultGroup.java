package org.studyhub.studyindex.model;

import java.util.List;

/**
 * Results sharing one parent entity, ranked by the best child.
 *
 * @param parentId parent identifier taken from the grouping metadata key
 * @param score    maximum child score
 * @param children member results, best first
 */
public record ResultGroup(String parentId, double score, List<SearchResult> children) {
}

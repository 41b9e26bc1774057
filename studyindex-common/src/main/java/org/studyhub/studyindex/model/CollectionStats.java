package org.studyhub.studyindex.model;

import java.util.Map;

public record CollectionStats(String name, String id, int count, Map<String, Object> metadata) {
}

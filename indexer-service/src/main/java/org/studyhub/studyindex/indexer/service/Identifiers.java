package org.studyhub.studyindex.indexer.service;

final class Identifiers {

    private Identifiers() {
    }

    static String require(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return id.strip();
    }

    static String orDefault(String id, String fallback) {
        return (id == null || id.isBlank()) ? fallback : id.strip();
    }
}

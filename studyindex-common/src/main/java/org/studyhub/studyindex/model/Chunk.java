package org.studyhub.studyindex.model;

import lombok.Data;

import java.util.Map;

/**
 * A bounded slice of a longer text, carrying the caller's metadata plus its position.
 */
@Data
public class Chunk {

    public static final String CHUNK_INDEX = "chunk_index";
    public static final String TOTAL_CHUNKS = "total_chunks";

    private String text;
    private int index;
    private int total;
    private Map<String, String> metadata;

    public Chunk(String text, int index, int total, Map<String, String> metadata) {
        if (index < 0 || index >= total) {
            throw new IllegalArgumentException("chunk index " + index + " outside [0, " + total + ")");
        }
        this.text = text;
        this.index = index;
        this.total = total;
        this.metadata = metadata;
    }

    /**
     * Document id following {@code {parentId}_{childId}_{chunkIndex}}.
     */
    public String documentId(String parentId, String childId) {
        return parentId + "_" + childId + "_" + index;
    }
}

package org.studyhub.studyindex.indexer.service;

import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.model.Chunk;
import org.studyhub.studyindex.service.EmbeddingProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Embeds and stores the chunks of one child text in a single add call.
 */
final class ChunkWriter {

    private ChunkWriter() {
    }

    /**
     * @return number of chunks stored
     */
    static int write(VectorStoreClient vectorStoreClient,
                     EmbeddingProvider embeddingProvider,
                     String collection,
                     List<Chunk> chunks,
                     String parentId,
                     String childId) {
        if (chunks.isEmpty()) {
            return 0;
        }

        List<String> ids = new ArrayList<>(chunks.size());
        List<String> texts = new ArrayList<>(chunks.size());
        List<Map<String, String>> metadatas = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            ids.add(chunk.documentId(parentId, childId));
            texts.add(chunk.getText());
            metadatas.add(chunk.getMetadata());
        }

        vectorStoreClient.addDocuments(collection, ids, texts, metadatas, embeddingProvider.embedAll(texts));
        return chunks.size();
    }
}

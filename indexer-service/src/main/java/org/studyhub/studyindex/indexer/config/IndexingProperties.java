package org.studyhub.studyindex.indexer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.studyhub.studyindex.service.chunking.TextChunker;

/**
 * Configuration for chunking and the ingestion worker pool.
 *
 * <p>Bound from {@code indexing.*} in {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "indexing")
public class IndexingProperties {

    private Chunking chunking = new Chunking();
    private Executor executor = new Executor();

    @Data
    public static class Chunking {
        private int chunkSize = TextChunker.DEFAULT_CHUNK_SIZE;
        private int overlap = TextChunker.DEFAULT_OVERLAP;
    }

    @Data
    public static class Executor {

        /**
         * Core number of threads kept alive in the pool.
         */
        private int coreSize = 2;

        /**
         * Maximum number of threads allowed in the pool.
         */
        private int maxSize = 4;

        /**
         * Maximum number of queued indexing jobs before back-pressure applies.
         */
        private int queueCapacity = 100;

        /**
         * Seconds to wait during shutdown for running jobs to complete.
         */
        private int awaitTerminationSeconds = 30;
    }
}

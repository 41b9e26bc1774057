package org.studyhub.studyindex.indexer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.studyhub.studyindex.integrity.IntegrityMatcher;
import org.studyhub.studyindex.search.ExpansionMetadataCodec;
import org.studyhub.studyindex.search.ExpansionTuning;

/**
 * Configuration properties for search, expansion and integrity behaviour.
 *
 * <p>Bound from {@code retrieval.*} in {@code application.yml}.</p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {

    private Collections collections = new Collections();
    private Search search = new Search();
    private Expansion expansion = new Expansion();
    private Integrity integrity = new Integrity();

    /**
     * Names of the backing vector collections.
     */
    @Data
    public static class Collections {
        private String courses = "courses";
        private String courseContent = "course-content";
        private String personalResources = "personal-resources";
        private String faqs = "faq_collection";
        private String gradedAssignments = "graded-assignments";
    }

    @Data
    public static class Search {

        /** Result count used when a request does not specify one. */
        private int defaultLimit = 10;

        /** Upper bound on any requested result count. */
        private int maxLimit = 50;

        /** Minimum relevance used when a request does not specify one. */
        private double defaultMinScore = 0.01;

        public int resolveLimit(Integer requested) {
            if (requested == null || requested < 1) {
                return Math.min(defaultLimit, maxLimit);
            }
            return Math.min(requested, maxLimit);
        }

        public double resolveMinScore(Double requested) {
            double value = (requested == null || requested.isNaN()) ? defaultMinScore : requested;
            return Math.max(0.0d, Math.min(1.0d, value));
        }
    }

    @Data
    public static class Expansion {
        private boolean enabled = true;
        private int maxTerms = 8;
        private int explorationLimit = 10;

        /** Serialized JSON bound for the acronym and synonym metadata of indexed entities. */
        private int maxSerializedLength = ExpansionMetadataCodec.DEFAULT_MAX_SERIALIZED_LENGTH;

        public ExpansionTuning toTuning(Boolean requested) {
            boolean on = enabled && (requested == null || requested);
            return on ? new ExpansionTuning(true, maxTerms, explorationLimit) : ExpansionTuning.disabled();
        }
    }

    @Data
    public static class Integrity {
        private double threshold = IntegrityMatcher.DEFAULT_THRESHOLD;
        private int results = IntegrityMatcher.DEFAULT_RESULTS;

        /** Minimum question similarity for assignment search when a request does not specify one. */
        private double searchThreshold = 0.5;

        /** Reference questions fetched per assignment search before grouping. */
        private int searchCandidates = 100;

        public double resolveSearchThreshold(Double requested) {
            double value = (requested == null || requested.isNaN()) ? searchThreshold : requested;
            return Math.max(0.0d, Math.min(1.0d, value));
        }
    }
}

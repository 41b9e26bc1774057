package org.studyhub.studyindex.indexer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.filter.Filter;
import org.studyhub.studyindex.indexer.config.RetrievalProperties;
import org.studyhub.studyindex.indexer.model.FaqEntry;
import org.studyhub.studyindex.indexer.model.FaqRequest;
import org.studyhub.studyindex.indexer.model.SearchRequest;
import org.studyhub.studyindex.indexer.model.SearchResponse;
import org.studyhub.studyindex.model.SearchResult;
import org.studyhub.studyindex.model.VectorQueryResult;
import org.studyhub.studyindex.search.ScoringPolicy;
import org.studyhub.studyindex.service.EmbeddingProvider;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Frequently asked questions, stored one document per entry and scored with
 * {@link ScoringPolicy#LINEAR_CLAMP}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FaqService {

    public static final String TOPIC_KEY = "topic";

    private static final String ANSWER_MARKER = "\nANSWER: ";

    private final VectorStoreClient vectorStoreClient;
    private final EmbeddingProvider embeddingProvider;
    private final SemanticSearchService semanticSearchService;
    private final RetrievalProperties properties;

    /**
     * @return generated FAQ id
     */
    public String addFaq(FaqRequest request) {
        Identifiers.require(request.getQuestion(), "question");
        Identifiers.require(request.getAnswer(), "answer");

        String faqId = "faq_" + UUID.randomUUID().toString().replace("-", "");
        String topic = request.getTopic() == null ? "" : request.getTopic();
        String text = "TOPIC: " + topic + "\nQUESTION: " + request.getQuestion() + ANSWER_MARKER + request.getAnswer();

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("faq_id", faqId);
        metadata.put(TOPIC_KEY, topic);
        metadata.put("question", request.getQuestion());
        metadata.put("tags", request.getTags() == null ? "" : String.join(",", request.getTags()));
        metadata.put("created_by", request.getCreatedBy());
        metadata.put("last_updated", Instant.now().toString());
        metadata.put("type", "faq");

        vectorStoreClient.addDocuments(properties.getCollections().getFaqs(),
                List.of(faqId), List.of(text), List.of(metadata), List.of(embeddingProvider.embed(text)));

        log.info("Added FAQ item {} (topic={})", faqId, topic);
        return faqId;
    }

    /**
     * Reads one FAQ item back; the answer is taken from the stored document text.
     */
    public Optional<FaqEntry> getFaq(String faqId) {
        String id = Identifiers.require(faqId, "faqId");
        VectorQueryResult documents = vectorStoreClient.getDocuments(properties.getCollections().getFaqs(), List.of(id));
        if (documents.isEmpty()) {
            return Optional.empty();
        }

        String document = documents.document(0) == null ? "" : documents.document(0);
        Map<String, String> metadata = documents.metadata(0);
        int answerAt = document.indexOf(ANSWER_MARKER);
        String tags = metadata.getOrDefault("tags", "");

        return Optional.of(FaqEntry.builder()
                .faqId(id)
                .topic(metadata.get(TOPIC_KEY))
                .question(metadata.get("question"))
                .answer(answerAt < 0 ? document : document.substring(answerAt + ANSWER_MARKER.length()))
                .tags(tags.isBlank() ? List.of() : Arrays.asList(tags.split(",")))
                .createdBy(metadata.get("created_by"))
                .lastUpdated(metadata.get("last_updated"))
                .build());
    }

    public void deleteFaq(String faqId) {
        String id = Identifiers.require(faqId, "faqId");
        vectorStoreClient.deleteDocuments(properties.getCollections().getFaqs(), List.of(id), null);
        log.info("Deleted FAQ item {}", id);
    }

    /**
     * FAQ search; {@code scopeIds} are topics.
     */
    public SearchResponse search(SearchRequest request) {
        long startTime = System.currentTimeMillis();
        RetrievalProperties.Search search = properties.getSearch();
        int limit = search.resolveLimit(request.getLimit());
        double minScore = search.resolveMinScore(request.getMinScore());

        List<String> topics = request.getScopeIds();
        Filter filter = (topics == null || topics.isEmpty()) ? null : Filter.anyOf(TOPIC_KEY, topics);

        List<SearchResult> results = semanticSearchService.search(properties.getCollections().getFaqs(),
                request.getQuery(), List.of(), filter, ScoringPolicy.LINEAR_CLAMP, limit, minScore);

        return SearchResponse.builder()
                .query(request.getQuery())
                .results(results)
                .resultCount(results.size())
                .searchTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }
}

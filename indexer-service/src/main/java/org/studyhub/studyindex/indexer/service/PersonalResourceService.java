package org.studyhub.studyindex.indexer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.filter.Filter;
import org.studyhub.studyindex.indexer.config.RetrievalProperties;
import org.studyhub.studyindex.indexer.model.ResourceIndexRequest;
import org.studyhub.studyindex.indexer.model.ResourceIndexRequest.ResourceFile;
import org.studyhub.studyindex.indexer.model.SearchRequest;
import org.studyhub.studyindex.indexer.model.SearchResponse;
import org.studyhub.studyindex.model.SearchResult;
import org.studyhub.studyindex.search.ScoringPolicy;
import org.studyhub.studyindex.search.SearchRanker;
import org.studyhub.studyindex.service.EmbeddingProvider;
import org.studyhub.studyindex.service.chunking.TextChunker;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Indexes and searches students' personal study resources.
 *
 * <p>Every file of a resource becomes {@code {resourceId}_{fileId}_{chunkIndex}} chunks.
 * Searches are always restricted to the owning user.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PersonalResourceService {

    public static final String RESOURCE_KEY = "resource_id";
    public static final String USER_KEY = "user_id";
    public static final String FILE_KEY = "file_id";

    private final VectorStoreClient vectorStoreClient;
    private final EmbeddingProvider embeddingProvider;
    private final TextChunker textChunker;
    private final SearchRanker searchRanker;
    private final SemanticSearchService semanticSearchService;
    private final RetrievalProperties properties;

    /**
     * Replaces all chunks of the resource.
     *
     * @return number of chunks stored
     */
    public int indexResource(ResourceIndexRequest request) {
        String resourceId = Identifiers.require(request.getResourceId(), "resourceId");
        String userId = Identifiers.require(request.getUserId(), "userId");
        List<ResourceFile> files = request.getFiles() == null ? List.of() : request.getFiles();
        for (int i = 0; i < files.size(); i++) {
            Identifiers.require(files.get(i).getFileId(), "fileId of file " + i);
        }

        deleteResource(resourceId);

        String collection = properties.getCollections().getPersonalResources();
        int stored = 0;
        for (ResourceFile file : files) {
            String text = indexableText(file);
            if (text.isBlank()) {
                log.debug("Skipping empty file {} of resource {}", file.getFileId(), resourceId);
                continue;
            }

            String fileId = file.getFileId().strip();
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put(RESOURCE_KEY, resourceId);
            metadata.put(USER_KEY, userId);
            metadata.put(FILE_KEY, fileId);
            metadata.put("file_name", file.getName());
            metadata.put("file_type", file.getType());
            metadata.put("resource_title", request.getTitle());

            stored += ChunkWriter.write(vectorStoreClient, embeddingProvider, collection,
                    textChunker.chunk(text, metadata), resourceId, fileId);
        }

        log.info("Indexed personal resource {} for user {}: {} files, {} chunks",
                resourceId, userId, files.size(), stored);
        return stored;
    }

    public void deleteResource(String resourceId) {
        String id = Identifiers.require(resourceId, "resourceId");
        vectorStoreClient.deleteDocuments(properties.getCollections().getPersonalResources(),
                null, Filter.eq(RESOURCE_KEY, id));
        log.info("Deleted personal resource {}", id);
    }

    /**
     * Searches the user's resources, optionally limited to {@code scopeIds}, grouped per resource.
     */
    public SearchResponse search(SearchRequest request) {
        long startTime = System.currentTimeMillis();
        String userId = Identifiers.require(request.getUserId(), "userId");
        RetrievalProperties.Search search = properties.getSearch();
        int limit = search.resolveLimit(request.getLimit());
        double minScore = search.resolveMinScore(request.getMinScore());

        List<String> scopeIds = request.getScopeIds();
        Filter filter = Filter.both(Filter.eq(USER_KEY, userId),
                (scopeIds == null || scopeIds.isEmpty()) ? null : Filter.anyOf(RESOURCE_KEY, scopeIds));

        List<SearchResult> results = semanticSearchService.search(properties.getCollections().getPersonalResources(),
                request.getQuery(), List.of(), filter, ScoringPolicy.EXPONENTIAL_TAIL, limit, minScore);

        return SearchResponse.builder()
                .query(request.getQuery())
                .results(results)
                .groups(searchRanker.group(results, RESOURCE_KEY, limit))
                .resultCount(results.size())
                .searchTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    /**
     * Text stored for a file: the content of text entries and text files, a short descriptor
     * for URLs and binary files.
     */
    static String indexableText(ResourceFile file) {
        String content = file.getContent() == null ? "" : file.getContent();
        String type = file.getType() == null ? "text" : file.getType();
        String name = file.getName() == null ? "" : file.getName();

        switch (type) {
            case "url":
                return content.isBlank() ? "" : "URL: " + content.strip() + "\nName: " + name;
            case "file":
                String fileType = file.getFileType() == null ? "" : file.getFileType();
                if (fileType.startsWith("text/")) {
                    return content;
                }
                return "File: " + name + "\nType: " + fileType;
            default:
                return content;
        }
    }
}

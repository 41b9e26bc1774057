package org.studyhub.studyindex.indexer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.support.RestClientAdapter;
import org.springframework.web.service.invoker.HttpServiceProxyFactory;
import org.studyhub.studyindex.client.ChromaApi;
import org.studyhub.studyindex.client.RetrySettings;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.integrity.IntegrityMatcher;
import org.studyhub.studyindex.search.ExpansionMetadataCodec;
import org.studyhub.studyindex.search.QueryExpander;
import org.studyhub.studyindex.search.SearchRanker;
import org.studyhub.studyindex.service.EmbeddingService;
import org.studyhub.studyindex.service.chunking.TextChunker;

import java.time.Duration;

/**
 * Central Spring configuration for the indexer service.
 *
 * <p>Wires the Chroma client, the embedding service and the retrieval components from
 * {@code studyindex-common}. The core classes carry no Spring annotations; this is the
 * only place they are instantiated.</p>
 */
@Configuration
@EnableConfigurationProperties({
        IndexerAppConfig.ChromaProperties.class,
        IndexingProperties.class
})
public class IndexerAppConfig {

    // ----------------------------------------------------------------------
    // Chroma wiring
    // ----------------------------------------------------------------------

    @Bean
    public RestClient chromaRestClient(ChromaProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.getConnectTimeout());
        requestFactory.setReadTimeout(props.getReadTimeout());

        return RestClient.builder()
                .baseUrl(props.getUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public ChromaApi chromaApi(RestClient chromaRestClient) {
        return httpProxyFactory(chromaRestClient).createClient(ChromaApi.class);
    }

    @Bean
    public VectorStoreClient vectorStoreClient(ChromaApi chromaApi, ChromaProperties props) {
        ChromaProperties.Retry retry = props.getRetry();
        return new VectorStoreClient(chromaApi, new RetrySettings(
                retry.getConnectionAttempts(),
                retry.getCollectionAttempts(),
                retry.getSearchAttempts(),
                retry.getBaseDelay()
        ));
    }

    // ----------------------------------------------------------------------
    // Embedding and chunking
    // ----------------------------------------------------------------------

    @Bean
    public EmbeddingService embeddingService(EmbeddingModel embeddingModel) {
        return new EmbeddingService(embeddingModel,
                embeddingModel.getClass().getSimpleName());
    }

    @Bean
    public TextChunker textChunker(IndexingProperties props) {
        IndexingProperties.Chunking chunking = props.getChunking();
        return new TextChunker(chunking.getChunkSize(), chunking.getOverlap());
    }

    // ----------------------------------------------------------------------
    // Retrieval
    // ----------------------------------------------------------------------

    @Bean
    public ExpansionMetadataCodec expansionMetadataCodec(ObjectMapper objectMapper, RetrievalProperties props) {
        return new ExpansionMetadataCodec(objectMapper, props.getExpansion().getMaxSerializedLength());
    }

    @Bean
    public QueryExpander queryExpander(VectorStoreClient vectorStoreClient,
                                       EmbeddingService embeddingService,
                                       ExpansionMetadataCodec expansionMetadataCodec,
                                       RetrievalProperties props) {
        RetrievalProperties.Collections collections = props.getCollections();
        return new QueryExpander(vectorStoreClient, embeddingService, expansionMetadataCodec,
                collections.getCourses(), collections.getCourseContent());
    }

    @Bean
    public SearchRanker searchRanker() {
        return new SearchRanker();
    }

    @Bean
    public IntegrityMatcher integrityMatcher(VectorStoreClient vectorStoreClient,
                                             EmbeddingService embeddingService,
                                             RetrievalProperties props) {
        return new IntegrityMatcher(vectorStoreClient, embeddingService,
                props.getCollections().getGradedAssignments(),
                props.getIntegrity().getResults());
    }

    // ----------------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------------

    private static HttpServiceProxyFactory httpProxyFactory(RestClient restClient) {
        return HttpServiceProxyFactory
                .builderFor(RestClientAdapter.create(restClient))
                .build();
    }

    // ----------------------------------------------------------------------
    // Configuration properties
    // ----------------------------------------------------------------------

    @Data
    @ConfigurationProperties(prefix = "chroma")
    public static class ChromaProperties {
        private String url = "http://localhost:8000";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Retry retry = new Retry();

        @Data
        public static class Retry {
            private int connectionAttempts = 3;
            private int collectionAttempts = 3;
            private int searchAttempts = 7;
            private Duration baseDelay = Duration.ofMillis(500);
        }
    }
}

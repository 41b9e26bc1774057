package org.studyhub.studyindex.indexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor that runs asynchronous indexing jobs.
 *
 * <p>Kept apart from the JVM common pool so that ingestion has bounded concurrency and
 * queueing, and drains on shutdown. Used by {@code IndexingJobService}.
 */
@Configuration
public class IndexingExecutorConfig {

    @Bean(name = "indexingExecutor")
    public Executor indexingExecutor(IndexingProperties props) {
        IndexingProperties.Executor settings = props.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCoreSize());
        executor.setMaxPoolSize(settings.getMaxSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("indexing-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(settings.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }
}

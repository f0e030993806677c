package com.rsl.retrieval.execution;

import com.rsl.retrieval.index.IndexerProperties;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetrievalExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(@Value("${retrieval.execution.pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize), named("retrieval-search-"));
    }

    // separate from searchExecutor so a document search never waits on its own pool
    @Bean(destroyMethod = "shutdown")
    public ExecutorService documentLegExecutor(@Value("${retrieval.execution.pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize), named("retrieval-doc-leg-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService indexingExecutor(IndexerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrent()), named("retrieval-index-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService reindexJobExecutor() {
        return Executors.newSingleThreadExecutor(named("retrieval-reindex-job-"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

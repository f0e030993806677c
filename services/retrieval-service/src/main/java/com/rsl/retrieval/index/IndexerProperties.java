package com.rsl.retrieval.index;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retrieval.indexer")
public class IndexerProperties {
    private int batchSize = 10;
    private int maxConcurrent = 3;
    private int retryAttempts = 3;
    private long retryDelayMs = 1000;
    private long chunkDelayMs = 100;
    private long batchDelayMs = 1000;
    private String model;
    private int retainedJobs = 100;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    public long getChunkDelayMs() {
        return chunkDelayMs;
    }

    public void setChunkDelayMs(long chunkDelayMs) {
        this.chunkDelayMs = chunkDelayMs;
    }

    public long getBatchDelayMs() {
        return batchDelayMs;
    }

    public void setBatchDelayMs(long batchDelayMs) {
        this.batchDelayMs = batchDelayMs;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    /** Finished reindex jobs kept for lookup; queued and running jobs are never evicted. */
    public int getRetainedJobs() {
        return retainedJobs;
    }

    public void setRetainedJobs(int retainedJobs) {
        this.retainedJobs = retainedJobs;
    }
}

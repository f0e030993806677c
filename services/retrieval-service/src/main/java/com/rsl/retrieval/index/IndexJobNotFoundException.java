package com.rsl.retrieval.index;

public class IndexJobNotFoundException extends RuntimeException {
    private final String jobId;

    public IndexJobNotFoundException(String jobId) {
        super("reindex job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}

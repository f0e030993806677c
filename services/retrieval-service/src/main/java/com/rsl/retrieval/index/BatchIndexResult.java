package com.rsl.retrieval.index;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public final class BatchIndexResult {
    private final int total;
    private final int successful;
    private final int failed;
    private final List<IndexResult> results;
    private final long totalElapsedMs;

    public BatchIndexResult(int total, int successful, int failed, List<IndexResult> results, long totalElapsedMs) {
        this.total = total;
        this.successful = successful;
        this.failed = failed;
        this.results = results == null ? List.of() : List.copyOf(results);
        this.totalElapsedMs = totalElapsedMs;
    }

    public static BatchIndexResult empty() {
        return new BatchIndexResult(0, 0, 0, List.of(), 0L);
    }

    public int getTotal() {
        return total;
    }

    public int getSuccessful() {
        return successful;
    }

    public int getFailed() {
        return failed;
    }

    public List<IndexResult> getResults() {
        return results;
    }

    @JsonProperty("total_elapsed_ms")
    public long getTotalElapsedMs() {
        return totalElapsedMs;
    }
}

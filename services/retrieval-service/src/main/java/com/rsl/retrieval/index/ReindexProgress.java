package com.rsl.retrieval.index;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReindexProgress(
    int total,
    int processed,
    int successful,
    int failed,
    @JsonProperty("current_batch") int currentBatch,
    @JsonProperty("total_batches") int totalBatches,
    @JsonProperty("estimated_remaining_ms") long estimatedRemainingMs
) {
    public int percentComplete() {
        if (total <= 0) {
            return 100;
        }
        return (int) Math.min(100L, Math.round(processed * 100.0 / total));
    }
}

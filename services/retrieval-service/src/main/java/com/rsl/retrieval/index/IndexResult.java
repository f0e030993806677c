package com.rsl.retrieval.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IndexResult {
    private final String id;
    private final boolean success;
    private final boolean embeddingGenerated;
    private final long elapsedMs;
    private final String error;

    private IndexResult(String id, boolean success, boolean embeddingGenerated, long elapsedMs, String error) {
        this.id = id;
        this.success = success;
        this.embeddingGenerated = embeddingGenerated;
        this.elapsedMs = elapsedMs;
        this.error = error;
    }

    public static IndexResult indexed(String id, long elapsedMs) {
        return new IndexResult(id, true, true, elapsedMs, null);
    }

    public static IndexResult failed(String id, String error, long elapsedMs) {
        return new IndexResult(id, false, false, elapsedMs, error);
    }

    public String getId() {
        return id;
    }

    public boolean isSuccess() {
        return success;
    }

    @JsonProperty("embedding_generated")
    public boolean isEmbeddingGenerated() {
        return embeddingGenerated;
    }

    @JsonProperty("elapsed_ms")
    public long getElapsedMs() {
        return elapsedMs;
    }

    public String getError() {
        return error;
    }
}

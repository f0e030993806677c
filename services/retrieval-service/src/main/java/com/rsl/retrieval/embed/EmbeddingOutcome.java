package com.rsl.retrieval.embed;

import java.util.Objects;

/**
 * Result of one embedding request: either a vector or the reason it could not be produced.
 */
public final class EmbeddingOutcome {
    private final EmbeddingVector vector;
    private final String reason;

    private EmbeddingOutcome(EmbeddingVector vector, String reason) {
        this.vector = vector;
        this.reason = reason;
    }

    public static EmbeddingOutcome generated(EmbeddingVector vector) {
        return new EmbeddingOutcome(Objects.requireNonNull(vector, "vector"), null);
    }

    public static EmbeddingOutcome transientFailure(String reason) {
        return new EmbeddingOutcome(null, reason == null ? "embed_unavailable" : reason);
    }

    public boolean isGenerated() {
        return vector != null;
    }

    public EmbeddingVector getVector() {
        if (vector == null) {
            throw new IllegalStateException("no vector: " + reason);
        }
        return vector;
    }

    public String getReason() {
        return reason;
    }
}

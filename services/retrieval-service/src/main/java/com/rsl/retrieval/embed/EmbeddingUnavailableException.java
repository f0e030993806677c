package com.rsl.retrieval.embed;

/**
 * Thrown by the gateway; the message is a short reason code such as {@code embed_timeout}.
 */
public class EmbeddingUnavailableException extends RuntimeException {
    public EmbeddingUnavailableException(String reason) {
        super(reason);
    }

    public EmbeddingUnavailableException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public String getReason() {
        return getMessage();
    }
}

package com.rsl.retrieval.embed;

public interface EmbeddingProvider {
    EmbeddingOutcome generate(String text, String model);

    default EmbeddingOutcome generate(String text) {
        return generate(text, null);
    }
}

package com.rsl.retrieval.embed;

public enum EmbeddingMode {
    HTTP,
    LOCAL
}

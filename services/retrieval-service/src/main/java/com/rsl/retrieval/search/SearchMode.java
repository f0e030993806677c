package com.rsl.retrieval.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SearchMode {
    FULLTEXT("fulltext"),
    SEMANTIC("semantic"),
    HYBRID("hybrid");

    private final String key;

    SearchMode(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static SearchMode fromKey(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SearchMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown search mode: " + value);
    }
}

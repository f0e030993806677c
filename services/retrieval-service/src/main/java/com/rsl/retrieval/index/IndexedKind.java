package com.rsl.retrieval.index;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IndexedKind {
    DOCUMENTS("documents"),
    NOTES("notes");

    private final String key;

    IndexedKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static IndexedKind fromKey(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (IndexedKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}

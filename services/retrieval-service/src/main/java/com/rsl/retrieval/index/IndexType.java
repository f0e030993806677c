package com.rsl.retrieval.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IndexType {
    DOCUMENTS("documents"),
    NOTES("notes"),
    ALL("all");

    private final String key;

    IndexType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean includesDocuments() {
        return this == DOCUMENTS || this == ALL;
    }

    public boolean includesNotes() {
        return this == NOTES || this == ALL;
    }

    @JsonCreator
    public static IndexType fromKey(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (IndexType type : values()) {
            if (type.key.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown index_type: " + value);
    }
}

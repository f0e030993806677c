package com.rsl.retrieval.index;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ReindexJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}

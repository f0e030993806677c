package com.rsl.retrieval.index;

import java.util.List;

/**
 * Text fields of a record about to be embedded. Notes carry only {@code body}.
 */
public record IndexableRecord(String id, String title, String description, String body, List<String> tags) {
    public IndexableRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static IndexableRecord note(String id, String content) {
        return new IndexableRecord(id, null, null, content, List.of());
    }
}

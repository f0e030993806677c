package com.rsl.retrieval.relevance;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class QueryTerms {
    private static final int MIN_TERM_LENGTH = 3;

    private QueryTerms() {
    }

    /**
     * Lowercased whitespace terms with short tokens dropped; used for title boosting.
     */
    public static List<String> forRanking(String query) {
        List<String> terms = new ArrayList<>();
        for (String term : split(query)) {
            if (term.length() >= MIN_TERM_LENGTH) {
                terms.add(term);
            }
        }
        return terms;
    }

    /**
     * Lowercased whitespace terms, no filtering.
     */
    public static List<String> split(String query) {
        List<String> terms = new ArrayList<>();
        if (query == null) {
            return terms;
        }
        for (String term : query.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }
}

package com.rsl.retrieval.relevance;

import java.util.List;
import java.util.Locale;

public final class SnippetBuilder {
    public static final int DEFAULT_MAX_LENGTH = 200;
    private static final int LEADING_CONTEXT = 50;
    private static final String ELLIPSIS = "...";

    private SnippetBuilder() {
    }

    public static String build(String content, String query) {
        return build(content, query, DEFAULT_MAX_LENGTH);
    }

    /**
     * Window of {@code maxLength} characters starting 50 characters before the earliest query
     * term. Without a match the window anchors on the end of the content.
     */
    public static String build(String content, String query, int maxLength) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String contentLower = content.toLowerCase(Locale.ROOT);
        List<String> terms = QueryTerms.split(query);
        int best = content.length();
        if (terms.isEmpty()) {
            best = 0;
        }
        for (String term : terms) {
            int position = contentLower.indexOf(term);
            if (position >= 0 && position < best) {
                best = position;
            }
        }
        int start = Math.max(0, best - LEADING_CONTEXT);
        int end = Math.min(content.length(), start + maxLength);
        StringBuilder snippet = new StringBuilder(end - start + 6);
        if (start > 0) {
            snippet.append(ELLIPSIS);
        }
        snippet.append(content, start, end);
        if (end < content.length()) {
            snippet.append(ELLIPSIS);
        }
        return snippet.toString();
    }
}

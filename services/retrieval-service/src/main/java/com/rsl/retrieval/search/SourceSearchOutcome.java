package com.rsl.retrieval.search;

import java.util.List;

/**
 * What one source contributed to a query: its results, or the reason it contributed nothing.
 */
public final class SourceSearchOutcome {
    private final SourceKind source;
    private final List<SearchResult> results;
    private final boolean failed;
    private final String errorMessage;
    private final long tookMs;

    private SourceSearchOutcome(
        SourceKind source,
        List<SearchResult> results,
        boolean failed,
        String errorMessage,
        long tookMs
    ) {
        this.source = source;
        this.results = results == null ? List.of() : List.copyOf(results);
        this.failed = failed;
        this.errorMessage = errorMessage;
        this.tookMs = tookMs;
    }

    public static SourceSearchOutcome success(SourceKind source, List<SearchResult> results, long tookMs) {
        return new SourceSearchOutcome(source, results, false, null, tookMs);
    }

    public static SourceSearchOutcome error(SourceKind source, String message, long tookMs) {
        return new SourceSearchOutcome(source, List.of(), true, message, tookMs);
    }

    public static SourceSearchOutcome unsupported(SourceKind source) {
        return new SourceSearchOutcome(source, List.of(), true, "no adapter registered", 0L);
    }

    public SourceKind getSource() {
        return source;
    }

    public List<SearchResult> getResults() {
        return results;
    }

    public boolean isFailed() {
        return failed;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public long getTookMs() {
        return tookMs;
    }
}

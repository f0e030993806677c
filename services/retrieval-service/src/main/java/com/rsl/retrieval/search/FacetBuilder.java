package com.rsl.retrieval.search;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class FacetBuilder {
    static final String LAST_24H = "last24h";
    static final String LAST_WEEK = "lastWeek";
    static final String LAST_MONTH = "lastMonth";
    static final String OLDER = "older";

    private FacetBuilder() {
    }

    static SearchResponse.Facets build(List<SearchResult> results, Instant now) {
        Map<String, Integer> sources = new LinkedHashMap<>();
        Map<String, Integer> dateRanges = new LinkedHashMap<>();
        Instant dayAgo = now.minus(Duration.ofDays(1));
        Instant weekAgo = now.minus(Duration.ofDays(7));
        Instant monthAgo = now.minus(Duration.ofDays(30));

        for (SearchResult result : results) {
            if (result.getSource() != null) {
                sources.merge(result.getSource().key(), 1, Integer::sum);
            }
            Instant updatedAt = result.getUpdatedAt();
            String bucket;
            if (updatedAt == null) {
                bucket = OLDER;
            } else if (!updatedAt.isBefore(dayAgo)) {
                bucket = LAST_24H;
            } else if (!updatedAt.isBefore(weekAgo)) {
                bucket = LAST_WEEK;
            } else if (!updatedAt.isBefore(monthAgo)) {
                bucket = LAST_MONTH;
            } else {
                bucket = OLDER;
            }
            dateRanges.merge(bucket, 1, Integer::sum);
        }
        return new SearchResponse.Facets(sources, dateRanges);
    }
}

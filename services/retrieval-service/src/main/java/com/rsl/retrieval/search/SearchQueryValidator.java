package com.rsl.retrieval.search;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Rejects malformed queries before any I/O and fills in defaults.
 */
@Component
public class SearchQueryValidator {
    static final int DEFAULT_LIMIT = 20;
    static final double DEFAULT_MIN_RELEVANCE = 0.3;
    static final double DEFAULT_SEMANTIC_THRESHOLD = 0.7;

    private final SearchProperties properties;

    public SearchQueryValidator(SearchProperties properties) {
        this.properties = properties;
    }

    public SearchQuery validate(SearchQuery query) {
        if (query == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        if (isBlank(query.getTenantId())) {
            throw new InvalidSearchRequestException("tenant_id is required");
        }
        if (isBlank(query.getUserId())) {
            throw new InvalidSearchRequestException("user_id is required");
        }
        String text = query.getQuery();
        if (isBlank(text)) {
            throw new InvalidSearchRequestException("query text is required");
        }
        if (text.length() > properties.getMaxQueryLength()) {
            throw new InvalidSearchRequestException(
                "query text must be at most " + properties.getMaxQueryLength() + " characters"
            );
        }
        if (query.getSources() != null && query.getSources().stream().anyMatch(Objects::isNull)) {
            throw new InvalidSearchRequestException("sources must not contain null");
        }
        if (query.getCaseId() != null && !isUuid(query.getCaseId())) {
            throw new InvalidSearchRequestException("case_id must be a UUID");
        }

        int limit = query.getLimit() == null ? DEFAULT_LIMIT : query.getLimit();
        if (limit < 1 || limit > properties.getMaxLimit()) {
            throw new InvalidSearchRequestException("limit must be between 1 and " + properties.getMaxLimit());
        }
        int offset = query.getOffset() == null ? 0 : query.getOffset();
        if (offset < 0) {
            throw new InvalidSearchRequestException("offset must be >= 0");
        }
        if ((long) offset + limit > properties.getMaxWindow()) {
            throw new InvalidSearchRequestException("offset + limit must be <= " + properties.getMaxWindow());
        }
        double minRelevance = query.getMinRelevanceScore() == null
            ? DEFAULT_MIN_RELEVANCE
            : query.getMinRelevanceScore();
        requireUnitInterval(minRelevance, "min_relevance_score");
        double semanticThreshold = query.getSemanticThreshold() == null
            ? DEFAULT_SEMANTIC_THRESHOLD
            : query.getSemanticThreshold();
        requireUnitInterval(semanticThreshold, "semantic_threshold");

        query.setLimit(limit);
        query.setOffset(offset);
        query.setMinRelevanceScore(minRelevance);
        query.setSemanticThreshold(semanticThreshold);
        if (query.getSearchMode() == null) {
            query.setSearchMode(SearchMode.HYBRID);
        }
        if (query.getIncludeMetadata() == null) {
            query.setIncludeMetadata(Boolean.TRUE);
        }
        if (query.getUserRoles() == null) {
            query.setUserRoles(List.of());
        }
        if (query.getSources() == null || query.getSources().isEmpty()) {
            query.setSources(new LinkedHashSet<>(properties.getDefaultSources()));
        }
        if (query.getFilters() == null) {
            query.setFilters(new SearchFilters());
        }
        return query;
    }

    private void requireUnitInterval(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidSearchRequestException(field + " must be between 0 and 1");
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    static boolean isUuid(String value) {
        if (value == null || value.length() != 36) {
            return false;
        }
        try {
            UUID.fromString(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}

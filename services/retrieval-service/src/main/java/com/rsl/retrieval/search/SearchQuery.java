package com.rsl.retrieval.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Set;

/**
 * Search request. Unset optional fields are filled with defaults by
 * {@link SearchQueryValidator}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchQuery {
    @JsonProperty("tenant_id")
    private String tenantId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("user_roles")
    private List<String> userRoles;

    private String query;

    private Set<SourceKind> sources;

    private SearchFilters filters;

    @JsonProperty("case_id")
    private String caseId;

    @JsonProperty("search_mode")
    private SearchMode searchMode;

    private Integer limit;

    private Integer offset;

    @JsonProperty("min_relevance_score")
    private Double minRelevanceScore;

    @JsonProperty("semantic_threshold")
    private Double semanticThreshold;

    @JsonProperty("include_metadata")
    private Boolean includeMetadata;

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public List<String> getUserRoles() {
        return userRoles;
    }

    public void setUserRoles(List<String> userRoles) {
        this.userRoles = userRoles;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Set<SourceKind> getSources() {
        return sources;
    }

    public void setSources(Set<SourceKind> sources) {
        this.sources = sources;
    }

    public SearchFilters getFilters() {
        return filters;
    }

    public void setFilters(SearchFilters filters) {
        this.filters = filters;
    }

    public String getCaseId() {
        return caseId;
    }

    public void setCaseId(String caseId) {
        this.caseId = caseId;
    }

    public SearchMode getSearchMode() {
        return searchMode;
    }

    public void setSearchMode(SearchMode searchMode) {
        this.searchMode = searchMode;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }

    public Double getMinRelevanceScore() {
        return minRelevanceScore;
    }

    public void setMinRelevanceScore(Double minRelevanceScore) {
        this.minRelevanceScore = minRelevanceScore;
    }

    public Double getSemanticThreshold() {
        return semanticThreshold;
    }

    public void setSemanticThreshold(Double semanticThreshold) {
        this.semanticThreshold = semanticThreshold;
    }

    public Boolean getIncludeMetadata() {
        return includeMetadata;
    }

    public void setIncludeMetadata(Boolean includeMetadata) {
        this.includeMetadata = includeMetadata;
    }
}

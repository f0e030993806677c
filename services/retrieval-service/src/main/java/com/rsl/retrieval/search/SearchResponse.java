package com.rsl.retrieval.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public class SearchResponse {
    private List<SearchResult> results;
    private int total;
    private String query;

    @JsonProperty("search_mode")
    private SearchMode searchMode;

    @JsonProperty("elapsed_ms")
    private long elapsedMs;

    private Facets facets;

    public List<SearchResult> getResults() {
        return results;
    }

    public void setResults(List<SearchResult> results) {
        this.results = results;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public SearchMode getSearchMode() {
        return searchMode;
    }

    public void setSearchMode(SearchMode searchMode) {
        this.searchMode = searchMode;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public void setElapsedMs(long elapsedMs) {
        this.elapsedMs = elapsedMs;
    }

    public Facets getFacets() {
        return facets;
    }

    public void setFacets(Facets facets) {
        this.facets = facets;
    }

    public static class Facets {
        private Map<String, Integer> sources;

        @JsonProperty("date_ranges")
        private Map<String, Integer> dateRanges;

        public Facets() {
        }

        public Facets(Map<String, Integer> sources, Map<String, Integer> dateRanges) {
            this.sources = sources;
            this.dateRanges = dateRanges;
        }

        public Map<String, Integer> getSources() {
            return sources;
        }

        public void setSources(Map<String, Integer> sources) {
            this.sources = sources;
        }

        public Map<String, Integer> getDateRanges() {
            return dateRanges;
        }

        public void setDateRanges(Map<String, Integer> dateRanges) {
            this.dateRanges = dateRanges;
        }
    }
}

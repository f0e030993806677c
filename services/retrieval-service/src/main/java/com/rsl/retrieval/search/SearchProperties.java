package com.rsl.retrieval.search;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retrieval.search")
public class SearchProperties {
    private List<SourceKind> defaultSources = new ArrayList<>(List.of(
        SourceKind.LEADS,
        SourceKind.CONTACTS,
        SourceKind.ACCOUNTS,
        SourceKind.OPPORTUNITIES,
        SourceKind.DOCUMENTS
    ));
    private int preFilterLimit = 100;
    private int rrfK = 60;
    private int maxQueryLength = 1000;
    private int maxLimit = 100;
    private int maxWindow = 10000;

    public List<SourceKind> getDefaultSources() {
        return defaultSources;
    }

    public void setDefaultSources(List<SourceKind> defaultSources) {
        this.defaultSources = defaultSources;
    }

    public int getPreFilterLimit() {
        return preFilterLimit;
    }

    public void setPreFilterLimit(int preFilterLimit) {
        this.preFilterLimit = preFilterLimit;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getMaxWindow() {
        return maxWindow;
    }

    public void setMaxWindow(int maxWindow) {
        this.maxWindow = maxWindow;
    }
}

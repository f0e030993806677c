package com.rsl.retrieval.relevance;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retrieval.relevance")
public class RelevanceProperties {
    private double fullTextWeight = 0.4;
    private double semanticWeight = 0.6;
    private double titleBoost = 2.0;
    private double recentBoost = 1.2;
    private double halfLifeDays = 30.0;
    private double minScore = 0.3;
    private int maxResults = 50;

    public double getFullTextWeight() {
        return fullTextWeight;
    }

    public void setFullTextWeight(double fullTextWeight) {
        this.fullTextWeight = fullTextWeight;
    }

    public double getSemanticWeight() {
        return semanticWeight;
    }

    public void setSemanticWeight(double semanticWeight) {
        this.semanticWeight = semanticWeight;
    }

    public double getTitleBoost() {
        return titleBoost;
    }

    public void setTitleBoost(double titleBoost) {
        this.titleBoost = titleBoost;
    }

    public double getRecentBoost() {
        return recentBoost;
    }

    public void setRecentBoost(double recentBoost) {
        this.recentBoost = recentBoost;
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public void setHalfLifeDays(double halfLifeDays) {
        this.halfLifeDays = halfLifeDays;
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }
}

package com.rsl.retrieval.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retrieval.resilience")
public class ResilienceProperties {
    private int embedFailureThreshold = 5;
    private long embedOpenMs = 30000;

    public int getEmbedFailureThreshold() {
        return embedFailureThreshold;
    }

    public void setEmbedFailureThreshold(int embedFailureThreshold) {
        this.embedFailureThreshold = embedFailureThreshold;
    }

    public long getEmbedOpenMs() {
        return embedOpenMs;
    }

    public void setEmbedOpenMs(long embedOpenMs) {
        this.embedOpenMs = embedOpenMs;
    }
}

package com.rsl.retrieval.embed;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Embedding provider settings shared by query-time search and the indexer.
 */
@ConfigurationProperties(prefix = "embedding")
public class EmbeddingProperties {
    private EmbeddingMode mode = EmbeddingMode.HTTP;
    private String baseUrl;
    private String model;
    /** Vector width; must match the {@code embedding} column. */
    private int dimensions = 384;
    private int timeoutMs = 2000;
    private int retryCount = 0;
    private Cache cache = new Cache();

    /**
     * The caller's model when given, otherwise the configured default.
     */
    public String resolveModel(String requested) {
        return requested == null || requested.isBlank() ? model : requested;
    }

    public Duration timeout() {
        return Duration.ofMillis(Math.max(1, timeoutMs));
    }

    public EmbeddingMode getMode() {
        return mode;
    }

    public void setMode(EmbeddingMode mode) {
        this.mode = mode;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    /**
     * Query embedding cache; entries longer than {@code maxTextLength} are never cached.
     */
    public static class Cache {
        private boolean enabled = false;
        private long ttlMs = 300000;
        private int maxEntries = 1000;
        private int maxTextLength = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public int getMaxTextLength() {
            return maxTextLength;
        }

        public void setMaxTextLength(int maxTextLength) {
            this.maxTextLength = maxTextLength;
        }
    }
}

package com.rsl.retrieval.embed;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class EmbeddingCacheServiceTest {

    private static EmbeddingVector vector(float value) {
        return new EmbeddingVector(new float[] {value, 1.0f}, "m");
    }

    private static EmbeddingProperties properties(boolean enabled, long ttlMs, int maxEntries) {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setModel("m");
        properties.getCache().setEnabled(enabled);
        properties.getCache().setTtlMs(ttlMs);
        properties.getCache().setMaxEntries(maxEntries);
        return properties;
    }

    @Test
    void entriesExpireAfterTtl() {
        AtomicLong now = new AtomicLong(0L);
        EmbeddingCacheService cache = new EmbeddingCacheService(properties(true, 100L, 10), now::get);

        cache.put("Contract Renewal", "m", vector(0.5f));
        assertThat(cache.get("Contract Renewal", "m")).isPresent();

        now.set(100L);
        assertThat(cache.get("Contract Renewal", "m")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void evictsLeastRecentlyUsedEntry() {
        EmbeddingCacheService cache = new EmbeddingCacheService(properties(true, 10_000L, 2), () -> 0L);

        cache.put("a", "m", vector(0.1f));
        cache.put("b", "m", vector(0.2f));
        cache.get("a", "m");
        cache.put("c", "m", vector(0.3f));

        assertThat(cache.get("a", "m")).isPresent();
        assertThat(cache.get("b", "m")).isEmpty();
        assertThat(cache.get("c", "m")).isPresent();
    }

    @Test
    void caseAndWhitespaceVariantsAreDistinctEntries() {
        EmbeddingCacheService cache = new EmbeddingCacheService(properties(true, 10_000L, 10), () -> 0L);

        cache.put("Contract Renewal", "m", vector(0.5f));

        assertThat(cache.get("contract renewal", "m")).isEmpty();
        assertThat(cache.get(" Contract Renewal ", "m")).isEmpty();
        assertThat(cache.get("Contract Renewal", "m")).isPresent();
    }

    @Test
    void modelIsPartOfKey() {
        EmbeddingCacheService cache = new EmbeddingCacheService(properties(true, 10_000L, 10), () -> 0L);

        cache.put("q", "m", vector(0.1f));

        assertThat(cache.get("q", "other")).isEmpty();
    }

    @Test
    void disabledCacheStoresNothing() {
        EmbeddingCacheService cache = new EmbeddingCacheService(properties(false, 10_000L, 10), () -> 0L);

        cache.put("q", "m", vector(0.1f));

        assertThat(cache.isEnabled()).isFalse();
        assertThat(cache.get("q", "m")).isEmpty();
        assertThat(cache.size()).isZero();
    }
}

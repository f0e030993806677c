package com.rsl.retrieval.embed;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Bounded LRU cache of embeddings with per-entry expiry. Keys hash the exact text together with
 * mode and model, so case and whitespace variants get their own vectors.
 */
@Service
public class EmbeddingCacheService {
    private final EmbeddingProperties properties;
    private final LongSupplier clockMs;
    private final Map<String, Entry> entries;

    @Autowired
    public EmbeddingCacheService(EmbeddingProperties properties) {
        this(properties, System::currentTimeMillis);
    }

    EmbeddingCacheService(EmbeddingProperties properties, LongSupplier clockMs) {
        this.properties = properties;
        this.clockMs = clockMs;
        int maxEntries = Math.max(1, properties.getCache().getMaxEntries());
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > maxEntries;
            }
        };
    }

    public boolean isEnabled() {
        return properties.getCache() != null && properties.getCache().isEnabled();
    }

    public Optional<EmbeddingVector> get(String text, String model) {
        String key = buildKey(text, model);
        if (key == null) {
            return Optional.empty();
        }
        synchronized (entries) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.expiresAtMs <= clockMs.getAsLong()) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.vector);
        }
    }

    public void put(String text, String model, EmbeddingVector vector) {
        String key = buildKey(text, model);
        long ttlMs = properties.getCache().getTtlMs();
        if (key == null || vector == null || ttlMs <= 0) {
            return;
        }
        synchronized (entries) {
            entries.put(key, new Entry(vector, clockMs.getAsLong() + ttlMs));
        }
    }

    int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private String buildKey(String text, String model) {
        if (!isEnabled() || text == null) {
            return null;
        }
        if (text.isBlank()) {
            return null;
        }
        int maxLength = properties.getCache().getMaxTextLength();
        if (maxLength > 0 && text.length() > maxLength) {
            return null;
        }
        String mode = properties.getMode() == null ? "" : properties.getMode().name();
        String resolvedModel = String.valueOf(properties.resolveModel(model));
        return "embed:" + mode + ":" + resolvedModel + ":" + sha256(text);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record Entry(EmbeddingVector vector, long expiresAtMs) {
    }
}

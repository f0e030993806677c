package com.rsl.retrieval.embed;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Deterministic unit-length vectors seeded from the text hash. Used in local mode so the
 * pipeline runs without the embedding service.
 */
@Component
public class ToyEmbedder {
    public static final String MODEL = "local-hash";

    private final int dimensions;

    public ToyEmbedder(EmbeddingProperties properties) {
        this.dimensions = Math.max(1, properties.getDimensions());
    }

    public EmbeddingVector embed(String text) {
        Random random = new Random(stableSeed(text == null ? "" : text));
        float[] values = new float[dimensions];
        double sumSquares = 0.0;
        for (int i = 0; i < dimensions; i++) {
            double value = random.nextDouble() * 2.0 - 1.0;
            values[i] = (float) value;
            sumSquares += value * value;
        }
        double norm = Math.sqrt(sumSquares);
        if (norm == 0.0) {
            norm = 1.0;
        }
        for (int i = 0; i < dimensions; i++) {
            values[i] = (float) (values[i] / norm);
        }
        return new EmbeddingVector(values, MODEL);
    }

    private long stableSeed(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.rsl.retrieval.embed;

import java.util.Arrays;
import java.util.List;

public final class EmbeddingVector {
    private final float[] values;
    private final String model;

    public EmbeddingVector(float[] values, String model) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("embedding vector must not be empty");
        }
        this.values = Arrays.copyOf(values, values.length);
        this.model = model;
    }

    public static EmbeddingVector of(List<Double> values, String model) {
        float[] copy = new float[values.size()];
        for (int i = 0; i < copy.length; i++) {
            Double value = values.get(i);
            copy[i] = value == null ? 0.0f : value.floatValue();
        }
        return new EmbeddingVector(copy, model);
    }

    public float[] values() {
        return Arrays.copyOf(values, values.length);
    }

    public String model() {
        return model;
    }

    public int dimensions() {
        return values.length;
    }
}

package com.venturescout.vector;

import java.util.Locale;

/**
 * Offline bag-of-words encoder: every token increments the bucket picked by its hash. Texts with
 * the same words map to parallel vectors.
 */
public final class HashingEmbeddingClient implements EmbeddingClient {
    public static final int DEFAULT_DIMENSION = 384;

    private final int dimension;

    public HashingEmbeddingClient() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbeddingClient(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] encode(String text) {
        float[] vec = new float[dimension];
        if (text == null || text.isBlank()) {
            return vec;
        }
        String normalized = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9 ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
        if (normalized.isEmpty()) {
            return vec;
        }
        for (String token : normalized.split(" ")) {
            if (token.isBlank()) {
                continue;
            }
            vec[Math.floorMod(token.hashCode(), dimension)] += 1.0f;
        }
        return vec;
    }

    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "hashing-" + dimension;
    }
}

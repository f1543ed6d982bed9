package com.venturescout.vector;

/**
 * Turns text into a fixed-length vector. Implementations may be slow or remote and may throw
 * {@link EmbeddingException}; callers go through {@link SimilarityCache}.
 */
public interface EmbeddingClient {
    float[] encode(String text);

    default String name() {
        return getClass().getSimpleName();
    }
}

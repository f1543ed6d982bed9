package com.venturescout.vector;

/**
 * 0-100 similarity between two texts, computed from cached encodings.
 */
public final class TextSimilarity {
    private final SimilarityCache cache;

    public TextSimilarity(SimilarityCache cache) {
        if (cache == null) {
            throw new IllegalArgumentException("similarity cache is required");
        }
        this.cache = cache;
    }

    /**
     * @throws EmbeddingException when either text cannot be encoded
     */
    public double score(String left, String right) {
        if (left == null || left.isBlank() || right == null || right.isBlank()) {
            return 0.0;
        }
        float[] a = cache.getOrCompute(left);
        float[] b = cache.getOrCompute(right);
        return VectorMath.similarityScore(a, b);
    }

    public SimilarityCache cache() {
        return cache;
    }
}

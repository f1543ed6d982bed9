package com.venturescout.vector;

public final class VectorMath {
    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector is empty, all zeros, or the lengths differ.
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double na = 0.0;
        double nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na <= 0.0 || nb <= 0.0) {
            return 0.0;
        }
        double similarity = dot / (Math.sqrt(na) * Math.sqrt(nb));
        if (!Double.isFinite(similarity)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    /**
     * Cosine rescaled to a 0-100 score; negative similarity counts as 0.
     */
    public static double similarityScore(float[] a, float[] b) {
        double score = cosine(a, b) * 100.0;
        return Math.max(0.0, Math.min(100.0, score));
    }
}

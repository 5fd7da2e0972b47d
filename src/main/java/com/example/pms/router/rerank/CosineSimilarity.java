package com.example.pms.router.rerank;

/**
 * Cosine similarity over raw float vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * @return similarity in [-1, 1], or 0 when either vector is missing, empty, of a different
     * dimension, or has zero magnitude
     */
    public static double of(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /** Similarity clamped to [0, 1] for use as a ranking boost. */
    public static double clamped(float[] a, float[] b) {
        return clamp(of(a, b));
    }

    public static double clamp(double cosine) {
        return Math.max(0.0, Math.min(1.0, cosine));
    }
}

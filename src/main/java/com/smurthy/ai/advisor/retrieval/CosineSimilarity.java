package com.smurthy.ai.advisor.retrieval;

/**
 * Cosine similarity clamped to [0, 1]. Negative correlations score 0.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * @return {@code dot(a,b) / (|a| * |b|)} clamped to [0,1]; 0 when either norm is 0
     * @throws IllegalArgumentException when the vectors differ in dimension
     */
    public static double score(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vector dimensions differ: " + a.length + " vs " + b.length);
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

        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        if (Double.isNaN(cosine)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, cosine));
    }
}

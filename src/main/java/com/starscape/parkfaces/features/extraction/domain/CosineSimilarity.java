package com.starscape.parkfaces.features.extraction.domain;

/**
 * Cosine similarity over float embeddings.
 *
 * <p>The full formula dot(a, b) / (|a| * |b|) is always applied, so the score does not
 * depend on whether the model L2-normalizes its output.
 */
public final class CosineSimilarity {

    private static final double NORM_EPSILON = 1e-10;

    private CosineSimilarity() {
    }

    public static double between(float[] a, float[] b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Embeddings cannot be null");
        }
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        normA = Math.sqrt(normA);
        normB = Math.sqrt(normB);
        // A zero vector has no direction; it matches nothing
        if (normA < NORM_EPSILON || normB < NORM_EPSILON) {
            return 0.0;
        }
        double cosine = dot / (normA * normB);
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}

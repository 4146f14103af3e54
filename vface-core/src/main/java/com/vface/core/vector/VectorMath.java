package com.vface.core.vector;

/**
 * Vector operations used by fingerprint derivation and similarity matching.
 */
public final class VectorMath {

    private VectorMath() {}

    public static double magnitude(double[] vector) {
        double sum = 0.0;
        for (double v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Returns a unit-length copy of {@code vector}.
     *
     * @throws IllegalArgumentException if the vector has zero magnitude or non-finite components
     */
    public static double[] l2Normalize(double[] vector) {
        requireFinite(vector);
        double magnitude = magnitude(vector);
        if (magnitude == 0.0) {
            throw new IllegalArgumentException("Cannot normalize a zero vector");
        }
        double[] normalized = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = vector[i] / magnitude;
        }
        return normalized;
    }

    /**
     * Cosine similarity in [-1, 1]. Zero-magnitude inputs have similarity 0.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    public static void requireFinite(double[] vector) {
        for (int i = 0; i < vector.length; i++) {
            if (!Double.isFinite(vector[i])) {
                throw new IllegalArgumentException("Vector component " + i + " is not finite");
            }
        }
    }
}

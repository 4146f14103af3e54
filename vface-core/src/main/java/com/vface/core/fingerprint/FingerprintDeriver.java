package com.vface.core.fingerprint;

import com.vface.core.crypto.Hashing;
import com.vface.core.error.ValidationException;
import com.vface.core.vector.VectorMath;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derives the 64-hex identity fingerprint from a raw feature vector.
 *
 * <p>The vector is L2-normalized, every component is rounded half away from zero to a
 * fixed number of decimal places, the result is serialized as a compact JSON number array
 * ({@code [0.6,0.8,0]}) and the UTF-8 bytes are hashed with SHA-256.
 *
 * <p>There is no fuzzy tolerance here: vectors whose rounded components differ in a single
 * digit produce unrelated fingerprints. Approximate matching belongs to the similarity matcher.
 */
public final class FingerprintDeriver {

    public static final int DEFAULT_DIMENSION = 128;
    public static final int DEFAULT_PRECISION = 4;

    private final int dimension;
    private final int precision;

    public FingerprintDeriver(int dimension, int precision) {
        if (dimension < 1) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        if (precision < 0 || precision > 15) {
            throw new IllegalArgumentException("Precision must be between 0 and 15");
        }
        this.dimension = dimension;
        this.precision = precision;
    }

    public FingerprintDeriver() {
        this(DEFAULT_DIMENSION, DEFAULT_PRECISION);
    }

    public String derive(double[] vector) {
        return Hashing.sha256Hex(canonicalize(vector));
    }

    /**
     * Returns the canonical serialized form that {@link #derive(double[])} hashes.
     */
    public String canonicalize(double[] vector) {
        requireDimension(vector);
        double[] normalized;
        try {
            normalized = VectorMath.l2Normalize(vector);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("FP_002", e.getMessage());
        }

        StringBuilder sb = new StringBuilder(vector.length * 8);
        sb.append('[');
        for (int i = 0; i < normalized.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(quantize(normalized[i]));
        }
        sb.append(']');
        return sb.toString();
    }

    /**
     * Throws {@link DimensionMismatchException} unless {@code vector} has the configured dimension.
     */
    public void requireDimension(double[] vector) {
        if (vector == null) {
            throw new ValidationException("FP_003", "Vector is required");
        }
        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
    }

    private String quantize(double component) {
        BigDecimal rounded = new BigDecimal(component).setScale(precision, RoundingMode.HALF_UP);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    public int getDimension() {
        return dimension;
    }

    public int getPrecision() {
        return precision;
    }

    public static class DimensionMismatchException extends ValidationException {
        private final int expected;
        private final int actual;

        public DimensionMismatchException(int expected, int actual) {
            super("FP_001", "Vector must have " + expected + " dimensions, got " + actual);
            this.expected = expected;
            this.actual = actual;
        }

        public int getExpected() { return expected; }
        public int getActual() { return actual; }
    }
}

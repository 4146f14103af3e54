package com.vface.api.matching;

import com.vface.core.error.ValidationException;
import com.vface.core.fingerprint.FingerprintDeriver;
import com.vface.core.vector.VectorMath;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Similarity Matcher - cosine similarity lookups for verification search and Sybil rejection.
 */
@Service
public class SimilarityMatcher {

    private final VectorIndex vectorIndex;
    private final FingerprintDeriver fingerprintDeriver;
    private final double verificationThreshold;
    private final double sybilThreshold;
    private final int defaultTopK;
    private final int maxTopK;

    public SimilarityMatcher(
            VectorIndex vectorIndex,
            FingerprintDeriver fingerprintDeriver,
            @Value("${vface.matching.verification-threshold:0.85}") double verificationThreshold,
            @Value("${vface.matching.sybil-threshold:0.92}") double sybilThreshold,
            @Value("${vface.matching.default-top-k:5}") int defaultTopK,
            @Value("${vface.matching.max-top-k:100}") int maxTopK) {
        this.vectorIndex = vectorIndex;
        this.fingerprintDeriver = fingerprintDeriver;
        this.verificationThreshold = verificationThreshold;
        this.sybilThreshold = sybilThreshold;
        this.defaultTopK = defaultTopK;
        this.maxTopK = maxTopK;
    }

    /**
     * Returns up to {@code topK} stored identities at or above {@code threshold}.
     * Null arguments fall back to the configured defaults.
     */
    public List<VectorMatch> search(double[] vector, Double threshold, Integer topK) {
        validateVector(vector);
        double effectiveThreshold = threshold != null ? threshold : verificationThreshold;
        int effectiveTopK = topK != null ? topK : defaultTopK;
        if (Double.isNaN(effectiveThreshold) || effectiveThreshold < 0.0 || effectiveThreshold > 1.0) {
            throw new ValidationException("MATCH_001", "Threshold must be between 0 and 1");
        }
        if (effectiveTopK < 1 || effectiveTopK > maxTopK) {
            throw new ValidationException("MATCH_002", "topK must be between 1 and " + maxTopK);
        }
        return vectorIndex.query(vector, effectiveThreshold, effectiveTopK);
    }

    /**
     * Returns the most similar enrolled identity within the Sybil threshold, if any.
     */
    public Optional<VectorMatch> findSybilMatch(double[] vector) {
        validateVector(vector);
        return vectorIndex.query(vector, sybilThreshold, 1).stream().findFirst();
    }

    public double getVerificationThreshold() {
        return verificationThreshold;
    }

    public double getSybilThreshold() {
        return sybilThreshold;
    }

    private void validateVector(double[] vector) {
        fingerprintDeriver.requireDimension(vector);
        try {
            VectorMath.requireFinite(vector);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("MATCH_003", e.getMessage());
        }
    }
}

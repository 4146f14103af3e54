package com.vface.api.matching;

/**
 * A stored identity whose vector is similar to a query vector.
 */
public record VectorMatch(String fingerprint, String ownerKey, double similarity) {}

package com.vface.api.matching;

import java.util.List;

/**
 * Nearest-neighbour lookup over enrolled vectors.
 *
 * Implementations return matches at or above the threshold, ordered by similarity descending
 * with ties broken by enrollment order, and never include revoked identities.
 */
public interface VectorIndex {

    /**
     * Makes a newly enrolled vector searchable.
     */
    void insert(String fingerprint, double[] vector);

    /**
     * Removes a fingerprint from future results (called on revocation).
     */
    void remove(String fingerprint);

    List<VectorMatch> query(double[] vector, double threshold, int topK);
}

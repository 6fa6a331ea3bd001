package com.pdp.analytics;

import com.pdp.common.FeatureVector;

/**
 * Per-user plaintext cohort tests, evaluated on the same features that get
 * encrypted. These flags are computed outside the homomorphic pipeline and
 * therefore see individual behavior.
 */
public class CohortClassifier {
    private final double primaryShareThreshold;

    public CohortClassifier(double primaryShareThreshold) {
        if (Double.isNaN(primaryShareThreshold) || primaryShareThreshold < 0.0 || primaryShareThreshold > 1.0) {
            throw new IllegalArgumentException("primaryShareThreshold must be in [0, 1]: " + primaryShareThreshold);
        }
        this.primaryShareThreshold = primaryShareThreshold;
    }

    public double getPrimaryShareThreshold() {
        return primaryShareThreshold;
    }

    /** Share of category-A visits strictly above the threshold; never true for an empty history. */
    public boolean isPrimarilyCategoryA(FeatureVector v) {
        long total = v.getTotalVisits();
        return total > 0 && (double) v.getCategoryAVisits() / total > primaryShareThreshold;
    }

    public boolean exhibitsTransitionPattern(FeatureVector v) {
        return v.getTransitions() > 0;
    }

    public CohortTally tally(CohortTally tally, FeatureVector v) {
        return tally.add(isPrimarilyCategoryA(v), exhibitsTransitionPattern(v));
    }
}

package com.pdp.common;

import java.util.Arrays;

/**
 * FeatureVector: non-negative behavioral counts extracted from one user's history.
 * Immutable; lane order follows {@link Feature}.
 */
public final class FeatureVector {
    private final long[] counts;

    public FeatureVector(long totalVisits, long categoryAVisits, long categoryBVisits, long transitions) {
        this.counts = new long[]{totalVisits, categoryAVisits, categoryBVisits, transitions};
        for (Feature f : Feature.values()) {
            if (counts[f.ordinal()] < 0) {
                throw new IllegalArgumentException(f.label() + " must be non-negative: " + counts[f.ordinal()]);
            }
        }
    }

    public long get(Feature feature) {
        return counts[feature.ordinal()];
    }

    public long getTotalVisits() {
        return counts[Feature.TOTAL_VISITS.ordinal()];
    }

    public long getCategoryAVisits() {
        return counts[Feature.CATEGORY_A_VISITS.ordinal()];
    }

    public long getCategoryBVisits() {
        return counts[Feature.CATEGORY_B_VISITS.ordinal()];
    }

    public long getTransitions() {
        return counts[Feature.A_TO_B_TRANSITIONS.ordinal()];
    }

    public long[] toArray() {
        return counts.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FeatureVector that)) return false;
        return Arrays.equals(counts, that.counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return String.format("FeatureVector{total=%d, a=%d, b=%d, a->b=%d}",
                counts[0], counts[1], counts[2], counts[3]);
    }
}

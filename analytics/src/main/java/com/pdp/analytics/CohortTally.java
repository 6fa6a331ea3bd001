package com.pdp.analytics;

/**
 * Immutable cohort counters; merged the same way as {@link AggregateAccumulator}.
 */
public record CohortTally(int users, int primarilyCategoryA, int transitionPattern) {

    public static final CohortTally EMPTY = new CohortTally(0, 0, 0);

    public CohortTally add(boolean primarilyA, boolean pattern) {
        return new CohortTally(users + 1,
                primarilyCategoryA + (primarilyA ? 1 : 0),
                transitionPattern + (pattern ? 1 : 0));
    }

    public CohortTally merge(CohortTally other) {
        return new CohortTally(users + other.users,
                primarilyCategoryA + other.primarilyCategoryA,
                transitionPattern + other.transitionPattern);
    }

    public double primarilyCategoryAPercentage() {
        return AggregateStatistics.percentage(primarilyCategoryA, users);
    }

    public double transitionPatternPercentage() {
        return AggregateStatistics.percentage(transitionPattern, users);
    }
}

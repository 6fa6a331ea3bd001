package com.pdp.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decrypted population totals and the percentages derived from them.
 * Percentages are 0 when their denominator is 0.
 */
public record AggregateStatistics(
        @JsonProperty("total_visits") long totalVisits,
        @JsonProperty("category_a_visits") long categoryAVisits,
        @JsonProperty("category_b_visits") long categoryBVisits,
        @JsonProperty("category_a_to_b_transitions") long transitions,
        @JsonProperty("category_a_percentage") double categoryAPercentage,
        @JsonProperty("transition_percentage") double transitionPercentage) {

    public static AggregateStatistics of(long totalVisits, long categoryAVisits, long categoryBVisits, long transitions) {
        return new AggregateStatistics(totalVisits, categoryAVisits, categoryBVisits, transitions,
                percentage(categoryAVisits, totalVisits),
                percentage(transitions, categoryAVisits));
    }

    static double percentage(long part, long whole) {
        return whole == 0 ? 0.0 : (double) part / whole * 100.0;
    }
}

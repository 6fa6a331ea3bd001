package com.pdp.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdp.analytics.AggregateStatistics;
import com.pdp.analytics.CohortTally;

/**
 * Final result of one sampled analysis: decrypted aggregate statistics,
 * plaintext cohort percentages and sampling metadata.
 */
public record AnalyticsReport(
        @JsonProperty("aggregate_statistics") AggregateStatistics statistics,
        @JsonProperty("cohort_statistics") CohortStatistics cohort,
        @JsonProperty("metadata") Metadata metadata) {

    public record CohortStatistics(
            @JsonProperty("users") int users,
            @JsonProperty("primarily_category_a_users") int primarilyCategoryAUsers,
            @JsonProperty("transition_pattern_users") int transitionPatternUsers,
            @JsonProperty("primarily_category_a_percentage") double primarilyCategoryAPercentage,
            @JsonProperty("transition_pattern_percentage") double transitionPatternPercentage) {

        public static CohortStatistics from(CohortTally tally) {
            return new CohortStatistics(tally.users(), tally.primarilyCategoryA(), tally.transitionPattern(),
                    tally.primarilyCategoryAPercentage(), tally.transitionPatternPercentage());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Metadata(
            @JsonProperty("sample_size") int sampleSize,
            @JsonProperty("requested_sample_size") int requestedSampleSize,
            @JsonProperty("population_size") int populationSize,
            @JsonProperty("date_range") String dateRange,
            @JsonProperty("key_bits") int keyBits,
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("generated_at") String generatedAt) {
    }
}

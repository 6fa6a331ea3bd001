package com.pdp.common;

/**
 * The four per-user counts that make up a {@link FeatureVector}, in lane order.
 */
public enum Feature {
    TOTAL_VISITS("total_visits"),
    CATEGORY_A_VISITS("category_a_visits"),
    CATEGORY_B_VISITS("category_b_visits"),
    A_TO_B_TRANSITIONS("category_a_to_b_transitions");

    private final String label;

    Feature(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Number of lanes. */
    public static int count() {
        return values().length;
    }
}

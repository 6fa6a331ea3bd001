package com.pdp.analytics;

import com.pdp.common.BrowsingEvent;
import com.pdp.common.FeatureVector;

import java.util.List;
import java.util.Objects;

/**
 * FeatureExtractor: one forward pass over a time-ordered history.
 *
 * An event may match category A, category B, both or neither. A transition
 * is counted when an event matches B and the event right before it matched A;
 * any event that does not match A clears that state, so A→A→B counts and
 * A→x→B does not.
 * An event matching both categories right after a non-A event is not a
 * transition here, whereas the reference system counts it, so totals can
 * differ on overlapping markers.
 *
 * Stateless between calls; safe to share across threads.
 */
public class FeatureExtractor {
    private final CategoryMarkers categoryA;
    private final CategoryMarkers categoryB;

    public FeatureExtractor(CategoryMarkers categoryA, CategoryMarkers categoryB) {
        this.categoryA = Objects.requireNonNull(categoryA, "categoryA cannot be null");
        this.categoryB = Objects.requireNonNull(categoryB, "categoryB cannot be null");
    }

    public CategoryMarkers getCategoryA() {
        return categoryA;
    }

    public CategoryMarkers getCategoryB() {
        return categoryB;
    }

    public FeatureVector extract(List<BrowsingEvent> events) {
        Objects.requireNonNull(events, "events cannot be null");
        long a = 0, b = 0, transitions = 0;
        boolean lastWasA = false;
        for (BrowsingEvent e : events) {
            boolean isA = categoryA.matches(e.getSite());
            boolean isB = categoryB.matches(e.getSite());
            if (isA) a++;
            if (isB) {
                b++;
                if (lastWasA) transitions++;
            }
            lastWasA = isA;
        }
        return new FeatureVector(events.size(), a, b, transitions);
    }

    /** Same as {@link #extract(List)} for a bare site sequence. */
    public FeatureVector extractSites(List<String> sites) {
        Objects.requireNonNull(sites, "sites cannot be null");
        return extract(sites.stream().map(BrowsingEvent::ofSite).toList());
    }
}

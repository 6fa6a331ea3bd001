package com.pdp.loader;

import com.pdp.common.BrowsingEvent;
import com.pdp.common.PopulationIndex;

import java.util.*;

/**
 * Population held entirely in memory, in insertion order.
 */
public class InMemoryPopulationIndex implements PopulationIndex {

    private final Map<String, List<BrowsingEvent>> histories = new LinkedHashMap<>();
    private final String dateRange;

    public InMemoryPopulationIndex() {
        this(null);
    }

    public InMemoryPopulationIndex(String dateRange) {
        this.dateRange = dateRange;
    }

    /** Adds or replaces one user's history; events are stored as given. */
    public synchronized InMemoryPopulationIndex put(String userId, List<BrowsingEvent> events) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(events, "events");
        histories.put(userId, List.copyOf(events));
        return this;
    }

    /** Convenience for tests and fixtures: a history given by its site sequence. */
    public InMemoryPopulationIndex putSites(String userId, String... sites) {
        List<BrowsingEvent> events = new ArrayList<>(sites.length);
        for (int i = 0; i < sites.length; i++) {
            events.add(new BrowsingEvent(userId, i, sites[i], 0, i == 0 ? "direct" : sites[i - 1]));
        }
        return put(userId, events);
    }

    @Override
    public synchronized List<String> getUserIds() {
        return List.copyOf(histories.keySet());
    }

    @Override
    public synchronized List<BrowsingEvent> getEvents(String userId) {
        List<BrowsingEvent> events = histories.get(userId);
        if (events == null) {
            throw new IllegalArgumentException("Unknown user: " + userId);
        }
        return events;
    }

    @Override
    public synchronized int size() {
        return histories.size();
    }

    @Override
    public String getDateRange() {
        return dateRange;
    }
}

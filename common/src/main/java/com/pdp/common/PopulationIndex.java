package com.pdp.common;

import java.io.IOException;
import java.util.List;

/**
 * PopulationIndex is the collaborator that owns user histories.
 * <p>
 * The analytics core only ever asks two things of it:
 * <ul>
 *   <li>which users exist</li>
 *   <li>the time-ordered event log of one user</li>
 * </ul>
 * Storage (memory, files, a database) is the implementation's concern.
 */
public interface PopulationIndex {

    /**
     * All user identifiers in a stable order.
     *
     * @return immutable list of user IDs, without duplicates
     */
    List<String> getUserIds();

    /**
     * Loads the events of one user, ordered by time.
     *
     * @param userId a user returned by {@link #getUserIds()}
     * @return the user's events; empty if the user has no history
     * @throws IOException if the backing store cannot be read
     * @throws IllegalArgumentException if the user is unknown
     */
    List<BrowsingEvent> getEvents(String userId) throws IOException;

    /** Number of users in the population. */
    default int size() {
        return getUserIds().size();
    }

    /**
     * Optional dataset description (e.g. the covered date range).
     *
     * @return a short human-readable description, or null if unknown
     */
    default String getDateRange() {
        return null;
    }
}

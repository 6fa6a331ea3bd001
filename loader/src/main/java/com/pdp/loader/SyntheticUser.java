package com.pdp.loader;

import com.pdp.common.BrowsingEvent;

import java.util.List;

/** One generated user: its hidden behavioral preferences and the resulting history. */
public record SyntheticUser(String userId,
                            double categoryAPreference,
                            double followUpPreference,
                            List<BrowsingEvent> events) {
    public SyntheticUser {
        events = List.copyOf(events);
    }
}

package com.pdp.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * BrowsingEvent: a single site visit in a user's time-ordered history.
 *
 * site      = visited site identifier (domain, optionally with path)
 * timestamp = epoch seconds of the visit
 * duration  = seconds spent on the site
 * referrer  = previous site, or "direct"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BrowsingEvent {
    private final String userId;
    private final long timestamp;
    private final String site;
    private final int duration;
    private final String referrer;

    @JsonCreator
    public BrowsingEvent(@JsonProperty("user_id") String userId,
                         @JsonProperty("timestamp") long timestamp,
                         @JsonProperty("site") String site,
                         @JsonProperty("duration") int duration,
                         @JsonProperty("referrer") String referrer) {
        this.userId = userId;
        this.timestamp = timestamp;
        this.site = Objects.requireNonNull(site, "site cannot be null");
        this.duration = Math.max(0, duration);
        this.referrer = referrer;
    }

    /** Site-only event, used where only the visit order matters. */
    public static BrowsingEvent ofSite(String site) {
        return new BrowsingEvent(null, 0L, site, 0, null);
    }

    @JsonProperty("user_id")
    public String getUserId() {
        return userId;
    }

    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }

    @JsonProperty("site")
    public String getSite() {
        return site;
    }

    @JsonProperty("duration")
    public int getDuration() {
        return duration;
    }

    @JsonProperty("referrer")
    public String getReferrer() {
        return referrer;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BrowsingEvent that)) return false;
        return timestamp == that.timestamp
                && duration == that.duration
                && Objects.equals(userId, that.userId)
                && site.equals(that.site)
                && Objects.equals(referrer, that.referrer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, timestamp, site, duration, referrer);
    }

    @Override
    public String toString() {
        return String.format("BrowsingEvent{user=%s, ts=%d, site=%s}", userId, timestamp, site);
    }
}

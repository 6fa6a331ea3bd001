package com.pdp.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk dataset manifest: dataset metadata plus one entry per user
 * pointing at the file that holds the user's events.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatasetManifest {

    @JsonProperty("metadata")
    public Metadata metadata = new Metadata();

    @JsonProperty("users")
    public Map<String, UserEntry> users = new LinkedHashMap<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        @JsonProperty("description")
        public String description;

        @JsonProperty("num_users")
        public int numUsers;

        @JsonProperty("date_range")
        public String dateRange;

        @JsonProperty("generated_at")
        public String generatedAt;

        @JsonProperty("version")
        public String version = "1.0";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserEntry {
        @JsonProperty("short_video_preference")
        public Double categoryAPreference;

        @JsonProperty("ecommerce_after_video_preference")
        public Double followUpPreference;

        @JsonProperty("num_events")
        public int numEvents;

        @JsonProperty("data_file")
        public String dataFile;
    }
}

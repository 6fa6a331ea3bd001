package com.pdp.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Canonical configuration for a privacy-preserving analytics run.
 *
 * - Loaded from JSON via {@link #load(String, boolean)}.
 * - Cached per absolute/real path.
 * - Exposes nested blocks: keygen, categories, cohort, sampling, output, synthetic.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyticsConfig {

    private static final int MIN_KEY_BITS = 16;
    private static final int MAX_KEY_BITS = 8192;
    private static final int MAX_PARALLELISM = 64;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Per-path cache for loaded configs. */
    private static final ConcurrentMap<String, AnalyticsConfig> configCache = new ConcurrentHashMap<>();

    /* ======================== Top-level fields ======================== */

    @JsonProperty("keyBits")
    private int keyBits = 1024;

    @JsonProperty("sampleSize")
    private int sampleSize = 1000;

    @JsonProperty("parallelism")
    private int parallelism = 1;

    @JsonProperty("profilerEnabled")
    private boolean profilerEnabled = true;

    @JsonProperty("keygen")
    private KeygenConfig keygen = new KeygenConfig();

    @JsonProperty("categories")
    private CategoriesConfig categories = new CategoriesConfig();

    @JsonProperty("cohort")
    private CohortConfig cohort = new CohortConfig();

    @JsonProperty("sampling")
    private SamplingConfig sampling = new SamplingConfig();

    @JsonProperty("output")
    private OutputConfig output = new OutputConfig();

    @JsonProperty("synthetic")
    private SyntheticConfig synthetic = new SyntheticConfig();

    /* ======================== Static loading API ======================== */

    public static AnalyticsConfig load(String path, boolean refresh) throws ConfigLoadException {
        Objects.requireNonNull(path, "Config path cannot be null");
        String key;
        try {
            Path p = Paths.get(path).toAbsolutePath().normalize();
            try {
                p = p.toRealPath();
            } catch (IOException ignore) {
                // fall back to normalized absolute path
            }
            key = p.toString();
        } catch (Exception e) {
            throw new ConfigLoadException("Invalid config path: " + path, e);
        }

        if (!refresh) {
            AnalyticsConfig cached = configCache.get(key);
            if (cached != null) return cached;
        }

        AnalyticsConfig cfg;
        try {
            Path p = Paths.get(key);
            if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
                throw new IOException("Config file not found or not readable: " + key);
            }
            cfg = MAPPER.readValue(p.toFile(), AnalyticsConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read/parse AnalyticsConfig from " + key, e);
        }

        if (cfg.keygen == null) cfg.keygen = new KeygenConfig();
        if (cfg.categories == null) cfg.categories = new CategoriesConfig();
        if (cfg.cohort == null) cfg.cohort = new CohortConfig();
        if (cfg.sampling == null) cfg.sampling = new SamplingConfig();
        if (cfg.output == null) cfg.output = new OutputConfig();
        if (cfg.synthetic == null) cfg.synthetic = new SyntheticConfig();

        cfg.keyBits     = normalizeKeyBits(cfg.keyBits);
        cfg.sampleSize  = Math.max(1, cfg.sampleSize);
        cfg.parallelism = clamp(cfg.parallelism, 1, MAX_PARALLELISM);

        configCache.put(key, cfg);
        return cfg;
    }

    public static void clearCache() {
        configCache.clear();
    }

    /* ======================== Getters used by other modules ======================== */

    /** Modulus size in bits; even and within [16, 8192]. */
    public int getKeyBits() {
        return normalizeKeyBits(keyBits);
    }

    public int getSampleSize() {
        return Math.max(1, sampleSize);
    }

    public int getParallelism() {
        return clamp(parallelism, 1, MAX_PARALLELISM);
    }

    public boolean isProfilerEnabled() {
        return profilerEnabled;
    }

    public KeygenConfig getKeygen() {
        return keygen;
    }

    public CategoriesConfig getCategories() {
        return categories;
    }

    public CohortConfig getCohort() {
        return cohort;
    }

    public SamplingConfig getSampling() {
        return sampling;
    }

    public OutputConfig getOutput() {
        return output;
    }

    public SyntheticConfig getSynthetic() {
        return synthetic;
    }

    /* ======================== Nested config types ======================== */

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeygenConfig {
        /** Bound on prime-pair draws before key generation gives up. */
        @JsonProperty("maxPrimeAttempts")
        public int maxPrimeAttempts = 16;

        public int getMaxPrimeAttempts() {
            return Math.max(1, maxPrimeAttempts);
        }
    }

    /**
     * Marker lists for the two tracked categories. A site belongs to a
     * category when it contains any of the category's markers.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CategoriesConfig {
        @JsonProperty("categoryA")
        public CategoryConfig categoryA = new CategoryConfig("short_video", List.of(
                "tiktok.com", "youtube.com/shorts", "instagram.com/reels",
                "snapchat.com", "vimeo.com/shorts", "triller.co", "byte.co",
                "dubsmash.com", "likee.com", "funimate.com"));

        @JsonProperty("categoryB")
        public CategoryConfig categoryB = new CategoryConfig("ecommerce", List.of(
                "amazon.com", "ebay.com", "walmart.com", "aliexpress.com",
                "etsy.com", "shopify.com", "bestbuy.com", "target.com",
                "newegg.com", "wayfair.com", "overstock.com", "homedepot.com"));

        public CategoryConfig getCategoryA() {
            return categoryA != null ? categoryA : new CategoryConfig("category_a", List.of());
        }

        public CategoryConfig getCategoryB() {
            return categoryB != null ? categoryB : new CategoryConfig("category_b", List.of());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CategoryConfig {
        @JsonProperty("name")
        public String name;

        @JsonProperty("markers")
        public List<String> markers = new ArrayList<>();

        public CategoryConfig() {
        }

        public CategoryConfig(String name, List<String> markers) {
            this.name = name;
            this.markers = new ArrayList<>(markers);
        }

        public String getName() {
            return (name == null || name.isBlank()) ? "unnamed" : name;
        }

        /** Non-blank markers, trimmed, in declaration order. */
        public List<String> getMarkers() {
            List<String> out = new ArrayList<>();
            if (markers == null) return out;
            for (String m : markers) {
                if (m != null && !m.isBlank()) out.add(m.trim());
            }
            return out;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CohortConfig {
        /** A user is "primarily category A" above this share of visits. */
        @JsonProperty("primaryShareThreshold")
        public double primaryShareThreshold = 0.5;

        public double getPrimaryShareThreshold() {
            if (Double.isNaN(primaryShareThreshold) || primaryShareThreshold < 0.0) return 0.0;
            if (primaryShareThreshold > 1.0) return 1.0;
            return primaryShareThreshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SamplingConfig {
        /** Optional; when set, sampling is reproducible. */
        @JsonProperty("seed")
        public Long seed;

        public Long getSeed() {
            return seed;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputConfig {
        @JsonProperty("resultsDir")
        public String resultsDir = "results";

        /** "json" | "csv". */
        @JsonProperty("format")
        public String format = "json";

        public String getResultsDir() {
            return (resultsDir == null || resultsDir.isBlank()) ? "results" : resultsDir;
        }

        public String getFormat() {
            String f = (format == null) ? "json" : format.trim().toLowerCase(Locale.ROOT);
            return f.equals("csv") ? "csv" : "json";
        }
    }

    /** Synthetic population used when no dataset manifest is given. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyntheticConfig {
        @JsonProperty("users")
        public int users = 100;

        @JsonProperty("minEvents")
        public int minEvents = 1000;

        @JsonProperty("maxEvents")
        public int maxEvents = 1000;

        @JsonProperty("seed")
        public long seed = 42L;

        public int getUsers() {
            return Math.max(1, users);
        }

        public int getMinEvents() {
            return Math.max(0, minEvents);
        }

        public int getMaxEvents() {
            return Math.max(getMinEvents(), maxEvents);
        }

        public long getSeed() {
            return seed;
        }
    }

    /* ======================== Helper methods ======================== */

    private static int normalizeKeyBits(int bits) {
        int b = clamp(bits, MIN_KEY_BITS, MAX_KEY_BITS);
        return b - (b % 2);
    }

    private static int clamp(int v, int min, int max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    /* ======================== Exception type ======================== */

    public static class ConfigLoadException extends Exception {
        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

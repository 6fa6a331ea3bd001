package com.pdp.common;

import java.io.FileWriter;
import java.io.IOException;
import java.util.*;

/**
 * Profiler
 *
 * Responsibilities:
 *  - Store per-label timings (ns)
 *  - Store one row per processed user (events, extraction and encryption cost)
 *
 * NOTE:
 *  Aggregation is NOT done here. This class only stores
 *  atomic observations; MicrometerProfiler mirrors them into meters.
 */
public final class Profiler {

    /* -----------------------------------------------------
     * Timing buckets: generic label → list<durationNs>
     * ----------------------------------------------------- */
    private final Map<String, Long> startTimes = new HashMap<>();
    private final Map<String, List<Long>> timings = new LinkedHashMap<>();

    /* -----------------------------------------------------
     * Per-user rows (one row per sampled user)
     * ----------------------------------------------------- */
    private final List<UserRow> userRows = new ArrayList<>();

    /* -----------------------------------------------------
     * TIMING API
     * ----------------------------------------------------- */

    public synchronized void start(String label) {
        startTimes.put(label, System.nanoTime());
    }

    public synchronized void stop(String label) {
        Long st = startTimes.remove(label);
        if (st == null) return;
        long dt = Math.max(0, System.nanoTime() - st);
        timings.computeIfAbsent(label, x -> new ArrayList<>()).add(dt);
    }

    public synchronized void recordTiming(String label, long durationNs) {
        if (durationNs < 0) durationNs = 0;
        timings.computeIfAbsent(label, x -> new ArrayList<>()).add(durationNs);
    }

    public synchronized List<Long> getTimings(String label) {
        List<Long> v = timings.get(label);
        return (v == null) ? Collections.emptyList() : new ArrayList<>(v);
    }

    /** Sum of all recordings under a label, in milliseconds. */
    public synchronized double totalMs(String label) {
        List<Long> v = timings.get(label);
        if (v == null) return 0.0;
        long sum = 0L;
        for (long ns : v) sum += ns;
        return sum / 1_000_000.0;
    }

    /* -----------------------------------------------------
     * PER-USER ROW API
     * ----------------------------------------------------- */

    /**
     * Store the cost of processing one user. The label is an opaque
     * ordinal ("u17"), never the user identifier.
     */
    public synchronized void recordUserRow(String label, int events, double extractMs, double encryptMs) {
        userRows.add(new UserRow(label, events, extractMs, encryptMs));
    }

    /** Copy of stored rows. */
    public synchronized List<UserRow> getUserRows() {
        return new ArrayList<>(userRows);
    }

    /* -----------------------------------------------------
     * CSV export
     * ----------------------------------------------------- */

    public synchronized void exportUserRowsCsv(String fp) throws IOException {
        try (FileWriter fw = new FileWriter(fp)) {
            fw.write("label,events,extractMs,encryptMs\n");
            for (UserRow r : userRows) {
                fw.write(String.format(Locale.ROOT,
                        "%s,%d,%.6f,%.6f%n",
                        r.label,
                        r.events,
                        r.extractMs,
                        r.encryptMs));
            }
        }
    }

    /* -----------------------------------------------------
     * USER ROW DTO
     * ----------------------------------------------------- */
    public static final class UserRow {
        public final String label;
        public final int events;
        public final double extractMs;
        public final double encryptMs;

        private UserRow(String label, int events, double extractMs, double encryptMs) {
            this.label = label;
            this.events = events;
            this.extractMs = extractMs;
            this.encryptMs = encryptMs;
        }
    }
}

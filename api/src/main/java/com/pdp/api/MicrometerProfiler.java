package com.pdp.api;

import com.pdp.common.Profiler;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Mirrors {@link Profiler} observations into Micrometer.
 *
 * start/stop suit single-threaded phases (keygen, sample); workers report
 * measured durations through {@link #record(String, long)}.
 */
public final class MicrometerProfiler {

    public static final String OPERATION_TIMER = "pdp.operation.duration";
    public static final String USER_EVENTS = "pdp.user.events";

    private final Profiler base;
    private final MeterRegistry registry;

    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Long> startTimes = new HashMap<>();

    private final DistributionSummary userEvents;

    public MicrometerProfiler(MeterRegistry reg, Profiler baseProfiler) {
        this.registry = Objects.requireNonNull(reg, "registry");
        this.base = Objects.requireNonNull(baseProfiler, "baseProfiler");
        this.userEvents = DistributionSummary.builder(USER_EVENTS)
                .description("Events per sampled user")
                .register(registry);
    }

    /* --------------------------------------------------------
     * TIMING WRAPPER
     * -------------------------------------------------------- */

    public synchronized void start(String op) {
        base.start(op);
        timer(op);
        startTimes.put(op, System.nanoTime());
    }

    public synchronized void stop(String op) {
        base.stop(op);
        Long st = startTimes.remove(op);
        if (st != null) {
            timer(op).record(System.nanoTime() - st, TimeUnit.NANOSECONDS);
        }
    }

    public void record(String op, long durationNs) {
        base.recordTiming(op, durationNs);
        timer(op).record(Math.max(0, durationNs), TimeUnit.NANOSECONDS);
    }

    /* --------------------------------------------------------
     * PER-USER ROW WRAPPER
     * -------------------------------------------------------- */

    public void recordUser(String label, int events, double extractMs, double encryptMs) {
        base.recordUserRow(label, events, extractMs, encryptMs);
        userEvents.record(events);
    }

    /* --------------------------------------------------------
     * EXPORTS
     * -------------------------------------------------------- */

    public void exportMetersCSV(String path) throws IOException {
        StringBuilder sb = new StringBuilder("name,tags,count,totalMs,meanMs,maxMs\n");

        for (Meter m : registry.getMeters()) {
            if (m instanceof Timer t) {
                long count = t.count();
                double total = t.totalTime(TimeUnit.MILLISECONDS);
                double mean = (count == 0 ? 0.0 : total / count);
                double max = t.max(TimeUnit.MILLISECONDS);

                sb.append(t.getId().getName()).append(',')
                        .append(tagString(t)).append(',')
                        .append(count).append(',')
                        .append(String.format(Locale.ROOT, "%.3f", total)).append(',')
                        .append(String.format(Locale.ROOT, "%.3f", mean)).append(',')
                        .append(String.format(Locale.ROOT, "%.3f", max)).append('\n');
            }
        }

        Path p = Paths.get(path).toAbsolutePath();
        if (p.getParent() != null) {
            Files.createDirectories(p.getParent());
        }
        Files.writeString(p, sb.toString());
    }

    public Profiler getBase() {
        return base;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private Timer timer(String op) {
        return timers.computeIfAbsent(op,
                k -> Timer.builder(OPERATION_TIMER).tag("op", k).register(registry));
    }

    // "op=keygen;..." so the column stays comma-free
    private static String tagString(Meter m) {
        StringBuilder sb = new StringBuilder();
        m.getId().getTags().forEach(tag -> {
            if (sb.length() > 0) sb.append(';');
            sb.append(tag.getKey()).append('=').append(tag.getValue());
        });
        return sb.toString();
    }
}

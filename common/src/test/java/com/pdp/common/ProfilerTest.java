package com.pdp.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfilerTest {

    @TempDir
    Path tempDir;

    @Test
    void userRowsExportCsv() throws IOException {
        Profiler profiler = new Profiler();
        profiler.recordUserRow("u0", 1000, 0.25, 12.5);
        profiler.recordUserRow("u1", 20, 0.01, 11.0);

        Path csv = tempDir.resolve("prof.csv");
        profiler.exportUserRowsCsv(csv.toString());

        List<String> lines = Files.readAllLines(csv);
        assertEquals("label,events,extractMs,encryptMs", lines.get(0));
        assertEquals(3, lines.size());
        assertTrue(lines.get(1).startsWith("u0,1000,"));
        assertEquals(4, lines.get(2).split(",", -1).length);
    }

    @Test
    void startStopRecordsOneTiming() {
        Profiler profiler = new Profiler();
        profiler.start("encrypt");
        profiler.stop("encrypt");
        profiler.stop("never-started");

        assertEquals(1, profiler.getTimings("encrypt").size());
        assertTrue(profiler.getTimings("never-started").isEmpty());
        assertTrue(profiler.totalMs("encrypt") >= 0.0);
    }

    @Test
    void negativeDurationsClampToZero() {
        Profiler profiler = new Profiler();
        profiler.recordTiming("x", -5);
        assertEquals(List.of(0L), profiler.getTimings("x"));
        assertEquals(0.0, profiler.totalMs("x"));
        assertEquals(0.0, profiler.totalMs("unknown"));
    }
}

package com.pdp.api;

import com.pdp.common.PopulationIndex;
import com.pdp.config.AnalyticsConfig;
import com.pdp.loader.JsonDatasetWriter;
import com.pdp.loader.SyntheticHistoryGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrivacyAnalyticsAppTest {

    @TempDir
    Path tmp;

    @AfterEach
    void cleanup() {
        AnalyticsConfig.clearCache();
    }

    private static AnalyticsConfig testConfig() throws Exception {
        Path cfg = Paths.get(PrivacyAnalyticsAppTest.class.getResource("/analytics-test-config.json").toURI());
        return AnalyticsConfig.load(cfg.toString(), true);
    }

    @Test
    void syntheticRunWritesReportAndProfiles() throws Exception {
        AnalyticsConfig cfg = testConfig();
        Path out = tmp.resolve("results/report.csv");

        AnalyticsReport report = PrivacyAnalyticsApp.run(cfg, "SYNTHETIC", cfg.getSampleSize(), out);

        assertEquals(8, report.metadata().sampleSize());
        assertEquals(12, report.metadata().populationSize());
        assertEquals(SyntheticHistoryGenerator.dateRange(), report.metadata().dateRange());
        assertTrue(report.statistics().totalVisits() >= 8 * 30);
        assertTrue(report.statistics().totalVisits() <= 8 * 60);

        assertTrue(Files.readAllLines(out).contains("Metadata,sample_size,8"));
        assertTrue(Files.exists(tmp.resolve("results/metrics.csv")));
        List<String> timings = Files.readAllLines(tmp.resolve("results/user_timings.csv"));
        assertEquals(1 + 8, timings.size());
    }

    @Test
    void manifestRunMatchesSyntheticPopulation() throws Exception {
        AnalyticsConfig cfg = testConfig();
        AnalyticsConfig.SyntheticConfig s = cfg.getSynthetic();
        Path manifest = JsonDatasetWriter.write(tmp.resolve("dataset"), "browser_history_dataset.json",
                new SyntheticHistoryGenerator(s.getSeed()).generateUsers(s.getUsers(), s.getMinEvents(), s.getMaxEvents()));

        PopulationIndex fromDisk = PrivacyAnalyticsApp.openPopulation(cfg, manifest.toString());
        PopulationIndex inMemory = PrivacyAnalyticsApp.openPopulation(cfg, "synthetic");
        assertEquals(inMemory.getUserIds(), fromDisk.getUserIds());

        // whole population on both sides: totals must agree
        AnalyticsReport a = PrivacyAnalyticsApp.run(cfg, manifest.toString(), 100, tmp.resolve("a.json"));
        AnalyticsReport b = PrivacyAnalyticsApp.run(cfg, "SYNTHETIC", 100, tmp.resolve("b.json"));
        assertEquals(a.statistics(), b.statistics());
        assertEquals(a.cohort(), b.cohort());
        assertTrue(Files.exists(tmp.resolve("a.json")));
    }
}

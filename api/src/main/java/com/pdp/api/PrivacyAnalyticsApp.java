package com.pdp.api;

import com.pdp.common.PopulationIndex;
import com.pdp.common.Profiler;
import com.pdp.config.AnalyticsConfig;
import com.pdp.loader.JsonDatasetLoader;
import com.pdp.loader.SyntheticHistoryGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point.
 *
 * Usage: {@code <configPath> <datasetManifest|SYNTHETIC> [sampleSize] [outputPath]}
 */
public final class PrivacyAnalyticsApp {
    private static final Logger logger = LoggerFactory.getLogger(PrivacyAnalyticsApp.class);

    static final String SYNTHETIC = "SYNTHETIC";
    private static final List<String> PHASES = List.of("sample", "keygen", "extract");

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: <configPath> <datasetManifest|SYNTHETIC> [sampleSize] [outputPath]");
            System.exit(1);
        }

        // ===================== ARGUMENTS =====================
        AnalyticsConfig cfg = AnalyticsConfig.load(args[0], false);
        final String dataset = args[1];
        final int sampleSize = (args.length >= 3) ? Integer.parseInt(args[2]) : cfg.getSampleSize();
        final Path resultsDir = Paths.get(cfg.getOutput().getResultsDir());
        final Path output = (args.length >= 4)
                ? Paths.get(args[3])
                : resultsDir.resolve("analytics_report." + cfg.getOutput().getFormat());

        AnalyticsReport report = run(cfg, dataset, sampleSize, output);

        logger.info("Users analyzed: {} of {} | category A share {}% | A->B transitions {}%",
                report.metadata().sampleSize(),
                report.metadata().populationSize(),
                String.format(Locale.ROOT, "%.2f", report.statistics().categoryAPercentage()),
                String.format(Locale.ROOT, "%.2f", report.statistics().transitionPercentage()));
    }

    static AnalyticsReport run(AnalyticsConfig cfg, String dataset, int sampleSize, Path output) throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AppBootstrap.Components c = AppBootstrap.init(cfg, registry);

        PopulationIndex population = openPopulation(cfg, dataset);
        logger.info("Population: {} users ({})", population.size(),
                population.getDateRange() == null ? "no date range" : population.getDateRange());

        AnalyticsReport report = c.orchestrator.run(population, sampleSize);
        new ReportWriter(output).write(report);

        if (cfg.isProfilerEnabled()) {
            Path dir = output.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            c.profiler.exportMetersCSV(dir.resolve("metrics.csv").toString());
            c.profiler.getBase().exportUserRowsCsv(dir.resolve("user_timings.csv").toString());
            logPhases(c.profiler.getBase());
        }
        return report;
    }

    private static void logPhases(Profiler profiler) {
        for (String phase : PHASES) {
            logger.info("Phase {}: {} runs, {} ms", phase,
                    profiler.getTimings(phase).size(),
                    String.format(Locale.ROOT, "%.2f", profiler.totalMs(phase)));
        }
    }

    static PopulationIndex openPopulation(AnalyticsConfig cfg, String dataset) throws IOException {
        if (SYNTHETIC.equalsIgnoreCase(dataset)) {
            AnalyticsConfig.SyntheticConfig s = cfg.getSynthetic();
            return new SyntheticHistoryGenerator(s.getSeed())
                    .generatePopulation(s.getUsers(), s.getMinEvents(), s.getMaxEvents());
        }
        return JsonDatasetLoader.load(Paths.get(dataset));
    }

    private PrivacyAnalyticsApp() {}
}

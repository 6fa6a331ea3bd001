package com.pdp.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pdp.analytics.AggregateStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes an {@link AnalyticsReport} to disk.
 *
 * A path ending in ".csv" produces a "Section,metric,value" table with one
 * section per report block; anything else is pretty-printed JSON.
 * Existing files are replaced.
 */
public class ReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path outputPath;
    private final boolean csvMode;

    public ReportWriter(Path outputPath) {
        Objects.requireNonNull(outputPath, "Output path cannot be null");
        this.outputPath = outputPath.toAbsolutePath().normalize();
        this.csvMode = this.outputPath.toString()
                .toLowerCase(Locale.ROOT)
                .endsWith(".csv");
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public void write(AnalyticsReport report) throws IOException {
        Objects.requireNonNull(report, "report cannot be null");
        Path parent = outputPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            if (csvMode) {
                writeCsv(report);
            } else {
                MAPPER.writeValue(outputPath.toFile(), report);
            }
            logger.info("Report written to {}", outputPath);
        } catch (IOException e) {
            logger.error("Failed to write report to {}", outputPath, e);
            throw new IOException("Failed to write report to " + outputPath, e);
        }
    }

    private void writeCsv(AnalyticsReport report) throws IOException {
        List<String[]> rows = new ArrayList<>();
        AggregateStatistics s = report.statistics();
        rows.add(row("AggregateStatistics", "total_visits", s.totalVisits()));
        rows.add(row("AggregateStatistics", "category_a_visits", s.categoryAVisits()));
        rows.add(row("AggregateStatistics", "category_b_visits", s.categoryBVisits()));
        rows.add(row("AggregateStatistics", "category_a_to_b_transitions", s.transitions()));
        rows.add(row("AggregateStatistics", "category_a_percentage", s.categoryAPercentage()));
        rows.add(row("AggregateStatistics", "transition_percentage", s.transitionPercentage()));

        AnalyticsReport.CohortStatistics c = report.cohort();
        rows.add(row("CohortStatistics", "users", c.users()));
        rows.add(row("CohortStatistics", "primarily_category_a_users", c.primarilyCategoryAUsers()));
        rows.add(row("CohortStatistics", "transition_pattern_users", c.transitionPatternUsers()));
        rows.add(row("CohortStatistics", "primarily_category_a_percentage", c.primarilyCategoryAPercentage()));
        rows.add(row("CohortStatistics", "transition_pattern_percentage", c.transitionPatternPercentage()));

        AnalyticsReport.Metadata m = report.metadata();
        rows.add(row("Metadata", "sample_size", m.sampleSize()));
        rows.add(row("Metadata", "requested_sample_size", m.requestedSampleSize()));
        rows.add(row("Metadata", "population_size", m.populationSize()));
        rows.add(row("Metadata", "date_range", m.dateRange()));
        rows.add(row("Metadata", "key_bits", m.keyBits()));
        rows.add(row("Metadata", "session_id", m.sessionId()));
        rows.add(row("Metadata", "generated_at", m.generatedAt()));

        try (BufferedWriter writer = Files.newBufferedWriter(outputPath)) {
            writer.write("Section,metric,value\n");
            for (String[] r : rows) {
                writer.write(String.join(",", escape(r)));
                writer.write("\n");
            }
        }
    }

    /* -------------------- helpers -------------------- */

    private static String[] row(String section, String metric, Object value) {
        String v;
        if (value == null) {
            v = "";
        } else if (value instanceof Double d) {
            v = String.format(Locale.ROOT, "%.4f", d);
        } else {
            v = value.toString();
        }
        return new String[]{section, metric, v};
    }

    private static String[] escape(String[] cells) {
        String[] out = new String[cells.length];
        for (int i = 0; i < cells.length; i++) {
            out[i] = escape(cells[i]);
        }
        return out;
    }

    private static String escape(String s) {
        if (s == null) return "";
        boolean needs = s.indexOf(',') >= 0
                || s.indexOf('"') >= 0
                || s.indexOf('\n') >= 0
                || s.indexOf('\r') >= 0;
        return needs ? "\"" + s.replace("\"", "\"\"") + "\"" : s;
    }
}

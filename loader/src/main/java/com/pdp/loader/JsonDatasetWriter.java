package com.pdp.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persists a generated population in the manifest layout read by {@link JsonDatasetLoader}:
 * {@code <dir>/<manifestName>} plus {@code <dir>/data/user_<id>.json} per user.
 */
public final class JsonDatasetWriter {
    private static final Logger logger = LoggerFactory.getLogger(JsonDatasetWriter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper COMPACT = new ObjectMapper();

    private JsonDatasetWriter() {}

    public static Path write(Path dir, String manifestName, List<SyntheticUser> users) throws IOException {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(manifestName, "manifestName");
        Objects.requireNonNull(users, "users");
        Path dataDir = dir.resolve("data");
        Files.createDirectories(dataDir);

        DatasetManifest manifest = new DatasetManifest();
        manifest.metadata.description = "Synthetic browser history dataset for privacy-preserving computation";
        manifest.metadata.numUsers = users.size();
        manifest.metadata.dateRange = SyntheticHistoryGenerator.dateRange();
        manifest.metadata.generatedAt = Instant.now().toString();

        for (SyntheticUser u : users) {
            String rel = "data/user_" + u.userId() + ".json";
            COMPACT.writeValue(dir.resolve(rel).toFile(), u.events());

            DatasetManifest.UserEntry entry = new DatasetManifest.UserEntry();
            entry.categoryAPreference = u.categoryAPreference();
            entry.followUpPreference = u.followUpPreference();
            entry.numEvents = u.events().size();
            entry.dataFile = rel;
            manifest.users.put(u.userId(), entry);
        }

        Path manifestPath = dir.resolve(manifestName);
        MAPPER.writeValue(manifestPath.toFile(), manifest);
        logger.info("Wrote dataset of {} users to {}", users.size(), manifestPath);
        return manifestPath;
    }
}

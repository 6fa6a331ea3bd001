package com.pdp.loader;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Opens a dataset manifest. Relative data files resolve against the manifest's directory.
 */
public final class JsonDatasetLoader {
    private static final Logger logger = LoggerFactory.getLogger(JsonDatasetLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonDatasetLoader() {}

    public static FileBackedPopulationIndex load(Path manifestPath) throws IOException {
        Objects.requireNonNull(manifestPath, "manifestPath");
        Path p = manifestPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
            throw new IOException("Dataset manifest not found or not readable: " + p);
        }
        DatasetManifest manifest = MAPPER.readValue(p.toFile(), DatasetManifest.class);
        if (manifest.users == null) {
            manifest.users = new LinkedHashMap<>();
        }
        if (manifest.metadata == null) {
            manifest.metadata = new DatasetManifest.Metadata();
        }
        Path baseDir = p.getParent() != null ? p.getParent() : Path.of(".").toAbsolutePath();
        logger.info("Loaded dataset manifest {} with {} users", p.getFileName(), manifest.users.size());
        return new FileBackedPopulationIndex(baseDir, manifest);
    }
}

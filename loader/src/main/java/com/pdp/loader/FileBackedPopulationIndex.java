package com.pdp.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pdp.common.BrowsingEvent;
import com.pdp.common.PopulationIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Population described by a {@link DatasetManifest}; each user's events are
 * read from disk on demand and returned sorted by timestamp.
 */
public class FileBackedPopulationIndex implements PopulationIndex {
    private static final Logger logger = LoggerFactory.getLogger(FileBackedPopulationIndex.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<BrowsingEvent>> EVENT_LIST = new TypeReference<>() {};

    private final Path baseDir;
    private final DatasetManifest manifest;
    private final List<String> userIds;

    FileBackedPopulationIndex(Path baseDir, DatasetManifest manifest) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.userIds = List.copyOf(manifest.users.keySet());
    }

    @Override
    public List<String> getUserIds() {
        return userIds;
    }

    @Override
    public List<BrowsingEvent> getEvents(String userId) throws IOException {
        DatasetManifest.UserEntry entry = manifest.users.get(userId);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown user: " + userId);
        }
        if (entry.dataFile == null || entry.dataFile.isBlank()) {
            throw new IOException("No data_file for user " + userId);
        }
        Path file = resolve(entry.dataFile);
        if (!Files.isRegularFile(file)) {
            throw new IOException("Event file not found: " + file);
        }
        List<BrowsingEvent> events = new ArrayList<>(MAPPER.readValue(file.toFile(), EVENT_LIST));
        // stable: equal timestamps keep file order
        events.sort(Comparator.comparingLong(BrowsingEvent::getTimestamp));
        if (entry.numEvents > 0 && entry.numEvents != events.size()) {
            logger.warn("Event count mismatch in {}: manifest={} file={}", file.getFileName(), entry.numEvents, events.size());
        }
        return events;
    }

    @Override
    public int size() {
        return userIds.size();
    }

    @Override
    public String getDateRange() {
        return manifest.metadata == null ? null : manifest.metadata.dateRange;
    }

    public DatasetManifest getManifest() {
        return manifest;
    }

    private Path resolve(String dataFile) {
        Path p = Path.of(dataFile);
        return p.isAbsolute() ? p.normalize() : baseDir.resolve(p).normalize();
    }
}

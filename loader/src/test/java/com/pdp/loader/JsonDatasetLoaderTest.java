package com.pdp.loader;

import com.pdp.common.BrowsingEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonDatasetLoaderTest {

    @TempDir
    Path tempDir;

    private Path writeManifest(String dataFile) throws IOException {
        Path manifest = tempDir.resolve("browser_history_dataset.json");
        Files.writeString(manifest, """
                {
                  "metadata": {"description": "test", "num_users": 1,
                               "date_range": "2024-01-01 to 2025-03-31", "version": "1.0"},
                  "users": {
                    "u1": {"short_video_preference": 0.4,
                           "ecommerce_after_video_preference": 0.3,
                           "num_events": 3,
                           "data_file": "%s",
                           "extra": true}
                  }
                }
                """.formatted(dataFile));
        return manifest;
    }

    @Test
    void loadsManifestAndResolvesRelativeDataFile() throws IOException {
        Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(tempDir.resolve("data/user_u1.json"), """
                [
                  {"user_id": "u1", "timestamp": 300, "site": "shop.example/cart", "duration": 5, "referrer": "a"},
                  {"user_id": "u1", "timestamp": 100, "site": "video.example/shorts", "duration": 7, "referrer": "direct"},
                  {"user_id": "u1", "timestamp": 200, "site": "news.example", "duration": 3, "referrer": "b", "unknown": 1}
                ]
                """);

        FileBackedPopulationIndex index = JsonDatasetLoader.load(writeManifest("data/user_u1.json"));

        assertEquals(List.of("u1"), index.getUserIds());
        assertEquals(1, index.size());
        assertEquals("2024-01-01 to 2025-03-31", index.getDateRange());
        assertEquals(0.4, index.getManifest().users.get("u1").categoryAPreference);

        List<BrowsingEvent> events = index.getEvents("u1");
        assertEquals(3, events.size());
        assertEquals(List.of(100L, 200L, 300L),
                events.stream().map(BrowsingEvent::getTimestamp).toList(),
                "events are returned sorted by timestamp");
        assertEquals("video.example/shorts", events.get(0).getSite());
    }

    @Test
    void equalTimestampsKeepFileOrder() throws IOException {
        Files.writeString(tempDir.resolve("u1.json"), """
                [
                  {"timestamp": 5, "site": "first"},
                  {"timestamp": 5, "site": "second"},
                  {"timestamp": 1, "site": "zero"}
                ]
                """);
        FileBackedPopulationIndex index = JsonDatasetLoader.load(writeManifest("u1.json"));

        assertEquals(List.of("zero", "first", "second"),
                index.getEvents("u1").stream().map(BrowsingEvent::getSite).toList());
    }

    @Test
    void missingEventFileIsAnIOException() throws IOException {
        FileBackedPopulationIndex index = JsonDatasetLoader.load(writeManifest("data/absent.json"));
        assertThrows(IOException.class, () -> index.getEvents("u1"));
    }

    @Test
    void unknownUserIsRejected() throws IOException {
        FileBackedPopulationIndex index = JsonDatasetLoader.load(writeManifest("u1.json"));
        assertThrows(IllegalArgumentException.class, () -> index.getEvents("nobody"));
    }

    @Test
    void missingManifestIsAnIOException() {
        assertThrows(IOException.class, () -> JsonDatasetLoader.load(tempDir.resolve("nope.json")));
    }

    @Test
    void manifestWithoutUsersIsEmpty() throws IOException {
        Path manifest = tempDir.resolve("empty.json");
        Files.writeString(manifest, "{\"metadata\": {\"description\": \"none\"}}");

        FileBackedPopulationIndex index = JsonDatasetLoader.load(manifest);
        assertEquals(0, index.size());
        assertTrue(index.getUserIds().isEmpty());
        assertNull(index.getDateRange());
    }
}

package com.pdp.loader;

import com.pdp.common.BrowsingEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticHistoryGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void sameSeedSameHistories() {
        List<SyntheticUser> a = new SyntheticHistoryGenerator(7L).generateUsers(5, 20, 40);
        List<SyntheticUser> b = new SyntheticHistoryGenerator(7L).generateUsers(5, 20, 40);
        assertEquals(a, b);

        List<SyntheticUser> c = new SyntheticHistoryGenerator(8L).generateUsers(5, 20, 40);
        assertNotEquals(a, c);
    }

    @Test
    void historiesRespectShapeAndDateRange() {
        long start = LocalDate.of(2024, 1, 1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        long end = LocalDate.of(2025, 3, 31).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        Set<String> catalog = SyntheticHistoryGenerator.SITE_CATALOG.values().stream()
                .flatMap(List::stream).collect(Collectors.toSet());

        List<SyntheticUser> users = new SyntheticHistoryGenerator(1L).generateUsers(10, 30, 60);
        assertEquals(10, users.size());
        assertEquals(10, users.stream().map(SyntheticUser::userId).distinct().count());

        for (SyntheticUser u : users) {
            assertTrue(u.categoryAPreference() >= 0 && u.categoryAPreference() <= 1);
            assertTrue(u.followUpPreference() >= 0 && u.followUpPreference() <= 1);
            assertTrue(u.events().size() >= 30 && u.events().size() <= 60);
            long prev = Long.MIN_VALUE;
            for (BrowsingEvent e : u.events()) {
                assertEquals(u.userId(), e.getUserId());
                assertTrue(catalog.contains(e.getSite()), e.getSite());
                assertTrue(e.getTimestamp() >= start && e.getTimestamp() < end);
                assertTrue(e.getDuration() >= 10 && e.getDuration() <= 1800);
                assertTrue(e.getTimestamp() >= prev, "sorted by timestamp");
                prev = e.getTimestamp();
            }
        }
    }

    @Test
    void generatedPopulationCarriesDateRange() throws IOException {
        InMemoryPopulationIndex index = new SyntheticHistoryGenerator(3L).generatePopulation(4, 10, 10);
        assertEquals(4, index.size());
        assertEquals("2024-01-01 to 2025-03-31", index.getDateRange());
        for (String id : index.getUserIds()) {
            assertEquals(10, index.getEvents(id).size());
        }
    }

    @Test
    void rejectsInvalidShape() {
        SyntheticHistoryGenerator gen = new SyntheticHistoryGenerator(0L);
        assertThrows(IllegalArgumentException.class, () -> gen.generateUsers(-1, 1, 2));
        assertThrows(IllegalArgumentException.class, () -> gen.generateUsers(1, 5, 2));
    }

    @Test
    void writtenDatasetLoadsBack() throws IOException {
        List<SyntheticUser> users = new SyntheticHistoryGenerator(11L).generateUsers(3, 15, 25);
        Path manifest = JsonDatasetWriter.write(tempDir, "browser_history_dataset.json", users);

        assertTrue(Files.isRegularFile(manifest));
        FileBackedPopulationIndex index = JsonDatasetLoader.load(manifest);

        assertEquals(users.stream().map(SyntheticUser::userId).toList(), index.getUserIds());
        assertEquals(SyntheticHistoryGenerator.dateRange(), index.getDateRange());
        for (SyntheticUser u : users) {
            assertEquals(u.events(), index.getEvents(u.userId()));
            assertEquals(u.events().size(), index.getManifest().users.get(u.userId()).numEvents);
        }
    }
}

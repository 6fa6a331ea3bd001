package com.pdp.key;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeyUsageTracker.
 */
public class KeyUsageTrackerTest {

    private KeyUsageTracker tracker;

    @BeforeEach
    public void setup() {
        tracker = new KeyUsageTracker();
    }

    @Test
    public void testTrackEncryption() {
        assertTrue(tracker.trackEncryption("user1", "k1"));
        assertEquals(1, tracker.getSubjectCount("k1"));
        assertEquals(0, tracker.getSubjectCount("k2"));
    }

    @Test
    public void testDuplicateRegistrationReported() {
        assertTrue(tracker.trackEncryption("user1", "k1"));
        assertFalse(tracker.trackEncryption("user1", "k1"));
        assertTrue(tracker.trackEncryption("user1", "k2"));
        assertEquals(1, tracker.getSubjectCount("k1"));
        assertEquals(1, tracker.getSubjectCount("k2"));
    }

    @Test
    public void testReleaseForgetsOnlyThatKey() {
        tracker.trackEncryption("a", "k1");
        tracker.trackEncryption("b", "k2");
        tracker.release("k1");
        assertEquals(0, tracker.getSubjectCount("k1"));
        assertEquals(1, tracker.getSubjectCount("k2"));
        assertTrue(tracker.trackEncryption("a", "k1"), "released key starts fresh");
    }

    @Test
    public void testConcurrentRegistrationCountsEachSubjectOnce() throws Exception {
        ExecutorService exec = Executors.newFixedThreadPool(8);
        AtomicInteger firsts = new AtomicInteger();
        for (int t = 0; t < 8; t++) {
            exec.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    if (tracker.trackEncryption("u" + i, "k")) firsts.incrementAndGet();
                }
            });
        }
        exec.shutdown();
        assertTrue(exec.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(500, firsts.get());
        assertEquals(500, tracker.getSubjectCount("k"));
    }
}

package com.pdp.loader;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPopulationIndexTest {

    @Test
    void keepsInsertionOrderAndReferrers() {
        InMemoryPopulationIndex index = new InMemoryPopulationIndex()
                .putSites("b", "x.example", "y.example")
                .putSites("a");

        assertEquals(List.of("b", "a"), index.getUserIds());
        assertEquals(2, index.size());
        assertNull(index.getDateRange());
        assertTrue(index.getEvents("a").isEmpty());
        assertEquals("direct", index.getEvents("b").get(0).getReferrer());
        assertEquals("x.example", index.getEvents("b").get(1).getReferrer());
    }

    @Test
    void unknownUserIsRejected() {
        InMemoryPopulationIndex index = new InMemoryPopulationIndex("r");
        assertEquals("r", index.getDateRange());
        assertThrows(IllegalArgumentException.class, () -> index.getEvents("ghost"));
    }
}

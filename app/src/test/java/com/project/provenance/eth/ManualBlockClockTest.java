package com.project.provenance.eth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ManualBlockClockTest {

    @Test
    void advancesAndNeverGoesBack() {
        ManualBlockClock clock = new ManualBlockClock(10);
        assertEquals(10, clock.currentHeight());
        assertEquals(11, clock.advance());
        assertEquals(16, clock.advanceBy(5));
        assertEquals(16, clock.advanceBy(0));
        assertThrows(IllegalArgumentException.class, () -> clock.advanceBy(-1));
        assertEquals(16, clock.currentHeight());
    }

    @Test
    void rejectsNegativeStart() {
        assertThrows(IllegalArgumentException.class, () -> new ManualBlockClock(-1));
        assertEquals(0, new ManualBlockClock().currentHeight());
    }
}

package io.hearthwarrio.veilguard.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QuietStateTest {

    private static final long MS = 1_000_000L;
    private static final long THRESHOLD = 10_000 * MS;

    @Test
    void staysActiveBelowThreshold() {
        QuietState q = new QuietState(0);

        assertFalse(q.onPassCompleted(0, 9_999 * MS, THRESHOLD));
        assertFalse(q.isActive());
    }

    @Test
    void turnsQuietAtThresholdWithoutHides() {
        QuietState q = new QuietState(0);

        assertTrue(q.onPassCompleted(0, 10_000 * MS, THRESHOLD));
    }

    @Test
    void passWithHidesNeverTurnsQuiet() {
        QuietState q = new QuietState(0);

        assertFalse(q.onPassCompleted(2, 20_000 * MS, THRESHOLD));
        assertEquals(20_000 * MS, q.getLastHideNanos());
    }

    @Test
    void singleHideResetsQuietAndTimer() {
        QuietState q = new QuietState(0);
        q.onPassCompleted(0, 12_000 * MS, THRESHOLD);
        assertTrue(q.isActive());

        q.recordHide(13_000 * MS);

        assertFalse(q.isActive());
        assertEquals(13_000 * MS, q.getLastHideNanos());
        assertFalse(q.onPassCompleted(0, 22_999 * MS, THRESHOLD));
        assertTrue(q.onPassCompleted(0, 23_000 * MS, THRESHOLD));
    }
}

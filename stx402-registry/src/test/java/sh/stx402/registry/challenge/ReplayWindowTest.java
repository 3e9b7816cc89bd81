// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.challenge;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

class ReplayWindowTest {

    private static final Instant NOW = Instant.ofEpochMilli(1_700_000_000_000L);
    private static final long NOW_MS = NOW.toEpochMilli();

    private final ReplayWindow window = ReplayWindow.DEFAULT;

    @Test
    void acceptsRecentTimestamps() {
        assertTrue(window.check(NOW_MS, NOW));
        assertTrue(window.check(NOW_MS - Duration.ofMinutes(4).toMillis(), NOW));
    }

    @Test
    void boundsAreInclusive() {
        assertTrue(window.check(NOW_MS - Duration.ofMinutes(5).toMillis(), NOW));
        assertTrue(window.check(NOW_MS + 30_000, NOW));
    }

    @Test
    void rejectsStaleTimestamps() {
        assertFalse(window.check(NOW_MS - Duration.ofMinutes(5).toMillis() - 1, NOW));
        assertFalse(window.check(NOW_MS - Duration.ofMinutes(10).toMillis(), NOW));
    }

    @Test
    void rejectsTimestampsTooFarAhead() {
        assertFalse(window.check(NOW_MS + 30_001, NOW));
    }

    @Test
    void customWindow() {
        ReplayWindow tight = new ReplayWindow(Duration.ofSeconds(10), Duration.ZERO);

        assertTrue(tight.check(NOW_MS - 10_000, NOW));
        assertFalse(tight.check(NOW_MS - 10_001, NOW));
        assertFalse(tight.check(NOW_MS + 1, NOW));
        assertThrows(IllegalArgumentException.class, () -> new ReplayWindow(Duration.ofSeconds(-1), Duration.ZERO));
    }
}

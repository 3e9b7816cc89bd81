// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.challenge;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Acceptance window for signed timestamps.
 *
 * <p>
 * A timestamp {@code t} (unix milliseconds) is accepted at {@code now} iff
 * {@code -futureSkew <= now - t <= maxAge}. Both bounds are inclusive.
 */
public record ReplayWindow(Duration maxAge, Duration futureSkew) {

    public static final ReplayWindow DEFAULT = new ReplayWindow(Duration.ofMinutes(5), Duration.ofSeconds(30));

    public ReplayWindow {
        Objects.requireNonNull(maxAge, "maxAge");
        Objects.requireNonNull(futureSkew, "futureSkew");
        if (maxAge.isNegative() || futureSkew.isNegative()) {
            throw new IllegalArgumentException("window bounds must not be negative");
        }
    }

    public boolean check(final long timestampMillis, final Instant now) {
        final long age = now.toEpochMilli() - timestampMillis;
        return age >= -futureSkew.toMillis() && age <= maxAge.toMillis();
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger, gated per channel by {@link Stx402Debug}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.stx402.debug");

    private DebugLogger() {
    }

    public static void logAuth(final String message, final Object... args) {
        if (!Stx402Debug.isAuthLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logRegistry(final String message, final Object... args) {
        if (!Stx402Debug.isRegistryLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logProbe(final String message, final Object... args) {
        if (!Stx402Debug.isProbeLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!Stx402Debug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Always sanitizes; signatures and keys must never reach a log sink.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core;

import static sh.stx402.core.AnsiColors.*;

import java.util.Locale;

/**
 * Formatter for debug log lines with status symbols (✓ ✗) and bracketed tags.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * DebugLogger.logAuth(LogFormatter.formatAuthDenied("delete", owner, "timestamp expired"));
 * // Output: ✗ [AUTH] op=delete owner=SP2J6Z...9EJ7 denied=timestamp expired
 *
 * DebugLogger.logProbe(LogFormatter.formatProbe(url, 402, true, 120_000));
 * // Output: ✓ [PROBE] url=https://api.example.com/x status=402 x402=true duration=120.00ms
 * }</pre>
 *
 * <p>All methods are side-effect free.
 *
 * @since 0.1.0
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int PREFIX_LENGTH = 6;
    private static final int SUFFIX_LENGTH = 4;
    private static final int SHORTEN_THRESHOLD = PREFIX_LENGTH + SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [AUTH] op=update owner=SP2J6Z...9EJ7 method=payment
     */
    public static String formatAuthGranted(String operation, String owner, String method) {
        return String.format(
                "%s✓%s %s[AUTH]%s op=%s owner=%s method=%s",
                TEAL, RESET,
                INDIGO, RESET,
                operation, shorten(owner), method);
    }

    /**
     * Format: ✗ [AUTH] op=delete owner=SP2J6Z...9EJ7 denied=timestamp expired
     */
    public static String formatAuthDenied(String operation, String owner, String reason) {
        return String.format(
                "%s✗%s %s[AUTH]%s op=%s owner=%s denied=%s%s%s",
                CORAL, RESET,
                INDIGO, RESET,
                operation, shorten(owner),
                CORAL, reason, RESET);
    }

    /**
     * Format: [REGISTRY] op=transfer id=3f2a9c1b00e4d7a1 owner=SP2J6Z...9EJ7
     */
    public static String formatRegistry(String operation, String id, String owner) {
        return String.format(
                "%s[REGISTRY]%s op=%s id=%s owner=%s",
                LAVENDER, RESET,
                operation, id, shorten(owner));
    }

    /**
     * Format: ✗ [REGISTRY-CONFLICT] op=register key=registry:url-hash:... attempt=1
     */
    public static String formatConflict(String operation, String key, int attempt) {
        return String.format(
                "%s✗%s %s[REGISTRY-CONFLICT]%s op=%s key=%s attempt=%d",
                CORAL, RESET,
                LAVENDER, RESET,
                operation, key, attempt);
    }

    /**
     * Format: ✓ [PROBE] url=https://api.example.com/x status=402 x402=true duration=120.00ms
     */
    public static String formatProbe(String url, int status, boolean x402, long durationMicros) {
        String symbol = x402 ? TEAL + "✓" + RESET : SLATE + "○" + RESET;
        return String.format(
                "%s %s[PROBE]%s url=%s status=%d x402=%s %s",
                symbol,
                AMBER, RESET,
                url, status, x402, duration(durationMicros));
    }

    /**
     * Format: ✗ [PROBE-ERROR] url=https://api.example.com/x code=PROBE_TIMEOUT message=... duration=10.00s
     */
    public static String formatProbeError(String url, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[PROBE-ERROR]%s url=%s code=%s message=%s %s",
                CORAL, RESET,
                AMBER, RESET,
                url, code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format(Locale.ROOT, "%.2fms", ms);
        } else {
            formatted = String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    /**
     * Shortens an address or hash: {@code SP2J6Z...9EJ7}.
     */
    static String shorten(String value) {
        if (value == null || value.length() <= SHORTEN_THRESHOLD) {
            return value;
        }
        return value.substring(0, PREFIX_LENGTH)
                + "..."
                + value.substring(value.length() - SUFFIX_LENGTH);
    }
}

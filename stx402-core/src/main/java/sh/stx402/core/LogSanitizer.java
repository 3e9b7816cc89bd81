// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts private keys and signatures (a logged signature plus its challenge
 * is a replayable credential until the challenge expires)</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern PRIVATE_KEY_PATTERN =
            Pattern.compile("\"privateKey\"\\s*:\\s*\"[^\"]+\"");

    private static final String PRIVATE_KEY_REPLACEMENT = "\"privateKey\":\"***[REDACTED]***\"";

    private static final Pattern SIGNATURE_PATTERN =
            Pattern.compile("\"signature\"\\s*:\\s*\"[^\"]+\"");

    private static final String SIGNATURE_REPLACEMENT = "\"signature\":\"***[REDACTED]***\"";

    /** Matches key=value style fields as produced by {@link LogFormatter}. */
    private static final Pattern SIGNATURE_KV_PATTERN =
            Pattern.compile("signature=(0x)?[0-9a-fA-F]{16,}");

    private static final String SIGNATURE_KV_REPLACEMENT = "signature=***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"privateKey\"")) {
            sanitized = PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(PRIVATE_KEY_REPLACEMENT);
        }

        if (sanitized.contains("\"signature\"")) {
            sanitized = SIGNATURE_PATTERN.matcher(sanitized).replaceAll(SIGNATURE_REPLACEMENT);
        }

        if (sanitized.contains("signature=")) {
            sanitized = SIGNATURE_KV_PATTERN.matcher(sanitized).replaceAll(SIGNATURE_KV_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}

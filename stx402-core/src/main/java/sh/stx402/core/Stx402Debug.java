// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core;

/**
 * Global toggle for verbose debug logging across stx402 modules.
 *
 * <p>Three channels exist: authorization decisions, registry mutations and
 * endpoint probes. The flags are volatile; the compound check in
 * {@link #isEnabled()} is not atomic, which is acceptable for logging.
 */
public final class Stx402Debug {

    private static volatile boolean authLogging = false;
    private static volatile boolean registryLogging = false;
    private static volatile boolean probeLogging = false;

    private Stx402Debug() {
    }

    /**
     * @return true if any debug channel is enabled
     */
    public static boolean isEnabled() {
        return authLogging || registryLogging || probeLogging;
    }

    public static void setEnabled(final boolean enabled) {
        authLogging = enabled;
        registryLogging = enabled;
        probeLogging = enabled;
    }

    public static void setAuthLogging(final boolean enabled) {
        authLogging = enabled;
    }

    public static boolean isAuthLoggingEnabled() {
        return authLogging;
    }

    public static void setRegistryLogging(final boolean enabled) {
        registryLogging = enabled;
    }

    public static boolean isRegistryLoggingEnabled() {
        return registryLogging;
    }

    public static void setProbeLogging(final boolean enabled) {
        probeLogging = enabled;
    }

    public static boolean isProbeLoggingEnabled() {
        return probeLogging;
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.config;

import java.time.Duration;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Registry deployment settings.
 *
 * <p>
 * Null components fall back to defaults, so {@code RegistryConfig.builder().build()}
 * is a working mainnet configuration without an administrator.
 *
 * @param network          network whose SIP-018 domain signatures are checked against
 * @param replayWindow     maximum age of a signed timestamp
 * @param futureSkew       how far a signed timestamp may lie in the future
 * @param challengeTtl     lifetime of an issued challenge
 * @param adminAddress     administrator address, compared by fingerprint
 * @param probeTimeout     hard timeout for a single endpoint probe
 * @param maxNameLength    longest accepted entry name
 * @param maxDescriptionLength longest accepted entry description
 */
public record RegistryConfig(
        Network network,
        Duration replayWindow,
        Duration futureSkew,
        Duration challengeTtl,
        @Nullable String adminAddress,
        Duration probeTimeout,
        int maxNameLength,
        int maxDescriptionLength) {

    public static final Duration DEFAULT_REPLAY_WINDOW = Duration.ofMinutes(5);
    public static final Duration DEFAULT_FUTURE_SKEW = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CHALLENGE_TTL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_NAME_LENGTH = 100;
    public static final int DEFAULT_MAX_DESCRIPTION_LENGTH = 500;

    public RegistryConfig {
        network = network == null ? Network.MAINNET : network;
        replayWindow = replayWindow == null ? DEFAULT_REPLAY_WINDOW : replayWindow;
        futureSkew = futureSkew == null ? DEFAULT_FUTURE_SKEW : futureSkew;
        challengeTtl = challengeTtl == null ? DEFAULT_CHALLENGE_TTL : challengeTtl;
        probeTimeout = probeTimeout == null ? DEFAULT_PROBE_TIMEOUT : probeTimeout;
        maxNameLength = maxNameLength <= 0 ? DEFAULT_MAX_NAME_LENGTH : maxNameLength;
        maxDescriptionLength = maxDescriptionLength <= 0 ? DEFAULT_MAX_DESCRIPTION_LENGTH : maxDescriptionLength;
        requirePositive(replayWindow, "replayWindow");
        requirePositive(challengeTtl, "challengeTtl");
        requirePositive(probeTimeout, "probeTimeout");
        if (futureSkew.isNegative()) {
            throw new IllegalArgumentException("futureSkew must not be negative");
        }
    }

    public static RegistryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(final Duration value, final String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    public static final class Builder {
        private Network network = Network.MAINNET;
        private Duration replayWindow = DEFAULT_REPLAY_WINDOW;
        private Duration futureSkew = DEFAULT_FUTURE_SKEW;
        private Duration challengeTtl = DEFAULT_CHALLENGE_TTL;
        private String adminAddress;
        private Duration probeTimeout = DEFAULT_PROBE_TIMEOUT;
        private int maxNameLength = DEFAULT_MAX_NAME_LENGTH;
        private int maxDescriptionLength = DEFAULT_MAX_DESCRIPTION_LENGTH;

        private Builder() {
        }

        public Builder network(final Network network) {
            this.network = network;
            return this;
        }

        public Builder replayWindow(final Duration replayWindow) {
            if (replayWindow != null) {
                this.replayWindow = replayWindow;
            }
            return this;
        }

        public Builder futureSkew(final Duration futureSkew) {
            if (futureSkew != null) {
                this.futureSkew = futureSkew;
            }
            return this;
        }

        public Builder challengeTtl(final Duration challengeTtl) {
            if (challengeTtl != null) {
                this.challengeTtl = challengeTtl;
            }
            return this;
        }

        public Builder adminAddress(final String adminAddress) {
            this.adminAddress = adminAddress;
            return this;
        }

        public Builder probeTimeout(final Duration probeTimeout) {
            if (probeTimeout != null) {
                this.probeTimeout = probeTimeout;
            }
            return this;
        }

        public Builder maxNameLength(final int maxNameLength) {
            this.maxNameLength = maxNameLength;
            return this;
        }

        public Builder maxDescriptionLength(final int maxDescriptionLength) {
            this.maxDescriptionLength = maxDescriptionLength;
            return this;
        }

        public RegistryConfig build() {
            return new RegistryConfig(network, replayWindow, futureSkew, challengeTtl, adminAddress,
                    probeTimeout, maxNameLength, maxDescriptionLength);
        }
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.probe;

import java.time.Duration;

/**
 * Settings for {@link HttpEndpointProber}.
 *
 * @param connectTimeout TCP connect timeout
 * @param timeout        hard deadline for a whole probe, all requests included
 * @param userAgent      User-Agent header sent with probes
 * @param blockPrivateTargets refuse loopback, private and internal hosts
 */
public record ProbeConfig(Duration connectTimeout, Duration timeout, String userAgent, boolean blockPrivateTargets) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_USER_AGENT = "stx402-registry-probe/0.1";

    public ProbeConfig {
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public static ProbeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration timeout = DEFAULT_TIMEOUT;
        private String userAgent = DEFAULT_USER_AGENT;
        private boolean blockPrivateTargets = true;

        private Builder() {
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder timeout(final Duration timeout) {
            if (timeout != null) {
                this.timeout = timeout;
            }
            return this;
        }

        public Builder userAgent(final String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder blockPrivateTargets(final boolean blockPrivateTargets) {
            this.blockPrivateTargets = blockPrivateTargets;
            return this;
        }

        public ProbeConfig build() {
            return new ProbeConfig(connectTimeout, timeout, userAgent, blockPrivateTargets);
        }
    }
}

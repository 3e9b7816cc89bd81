// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.probe;

import java.time.Duration;

/**
 * Classifies a URL as an x402 endpoint or not.
 *
 * <p>
 * Implementations never throw: every outcome, failures included, is a
 * {@link ProbeResult}. They do not retry.
 */
public interface EndpointProber {

    ProbeResult probe(String url, Duration timeout);

    default ProbeResult probe(final String url) {
        return probe(url, ProbeConfig.DEFAULT_TIMEOUT);
    }
}

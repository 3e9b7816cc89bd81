// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry;

import org.jspecify.annotations.Nullable;

import sh.stx402.registry.probe.ProbeResult;
import sh.stx402.registry.store.RegistryEntry;

/**
 * An entry plus, when requested, a live probe of its URL.
 */
public record EntryDetails(RegistryEntry entry, @Nullable ProbeResult liveProbe) {

    public boolean isOnline() {
        return liveProbe != null && liveProbe.success() && liveProbe.x402Endpoint();
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry;

import sh.stx402.registry.probe.ProbeResult;
import sh.stx402.registry.store.RegistryEntry;

/**
 * A newly stored entry and the probe that preceded it.
 */
public record Registration(RegistryEntry entry, ProbeResult probe) {
}

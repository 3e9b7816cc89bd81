// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import java.util.List;

/**
 * One page of entries plus the size of the filtered set.
 */
public record EntryPage(List<RegistryEntry> entries, int total, int offset, int limit) {

    public EntryPage {
        entries = List.copyOf(entries);
    }

    public boolean hasMore() {
        return offset + entries.size() < total;
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry;

import sh.stx402.registry.store.EntryStatus;

/**
 * Administrator verdict on an entry.
 */
public enum AdminDecision {
    VERIFY(EntryStatus.VERIFIED),
    REJECT(EntryStatus.REJECTED);

    private final EntryStatus status;

    AdminDecision(final EntryStatus status) {
        this.status = status;
    }

    public EntryStatus status() {
        return status;
    }
}

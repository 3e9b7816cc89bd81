// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.stx402.core.error.RegistryException;

/**
 * Lifecycle state of a registry entry.
 *
 * <p>
 * New entries start {@link #UNVERIFIED}; an administrator moves them to
 * {@link #VERIFIED} or {@link #REJECTED}. Re-probing never changes the status.
 */
public enum EntryStatus {
    UNVERIFIED("unverified"),
    VERIFIED("verified"),
    REJECTED("rejected");

    private final String value;

    EntryStatus(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EntryStatus fromValue(final String value) {
        for (EntryStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw RegistryException.invalidInput("Unknown entry status: " + value);
    }
}

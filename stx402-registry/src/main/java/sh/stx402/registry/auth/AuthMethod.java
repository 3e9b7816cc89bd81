// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.auth;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an authorized caller proved ownership.
 */
public enum AuthMethod {
    /** Nothing to prove. */
    OPEN("open"),
    SIGNATURE("signature"),
    PAYMENT("payment");

    private final String label;

    AuthMethod(final String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.auth;

import sh.stx402.core.crypto.sip018.SignedAction;

/**
 * Registry operations subject to an authorization decision.
 */
public enum Operation {
    REGISTER("register", null),
    UPDATE("update", SignedAction.UPDATE_ENDPOINT),
    LIST_MINE("list-mine", SignedAction.LIST_MY_ENDPOINTS),
    DELETE("delete", SignedAction.DELETE_ENDPOINT),
    TRANSFER("transfer", SignedAction.TRANSFER_OWNERSHIP);

    private final String label;
    private final SignedAction action;

    Operation(final String label, final SignedAction action) {
        this.label = label;
        this.action = action;
    }

    public String label() {
        return label;
    }

    /**
     * @return the signed action guarding this operation, null for {@link #REGISTER}
     */
    public SignedAction action() {
        return action;
    }

    /**
     * @return true for operations that need a consumed challenge
     */
    public boolean isChallenged() {
        return this == DELETE || this == TRANSFER;
    }
}

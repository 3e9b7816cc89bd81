// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.stx402.core.error.UnknownActionException;

/**
 * Closed set of actions an owner can sign. The tag is the {@code action} field of the
 * signed tuple.
 *
 * @since 0.1.0
 */
public enum SignedAction {
    DELETE_ENDPOINT("delete-endpoint"),
    LIST_MY_ENDPOINTS("list-my-endpoints"),
    TRANSFER_OWNERSHIP("transfer-ownership"),
    CHALLENGE_RESPONSE("challenge-response"),
    UPDATE_ENDPOINT("update-endpoint");

    private final String tag;

    SignedAction(final String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static SignedAction fromTag(final String tag) {
        for (SignedAction action : values()) {
            if (action.tag.equals(tag)) {
                return action;
            }
        }
        throw new UnknownActionException("Unknown action: " + tag);
    }
}

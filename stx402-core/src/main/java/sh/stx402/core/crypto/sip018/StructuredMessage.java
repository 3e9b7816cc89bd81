// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import sh.stx402.core.error.UnknownActionException;

/**
 * An action-typed message ready for SIP-018 signing.
 *
 * <p>
 * Tuple shapes (keys serialize in sorted order regardless of the order shown):
 * <pre>
 * delete-endpoint     {action, url, owner, timestamp}
 * list-my-endpoints   {action, owner, timestamp}
 * transfer-ownership  {action, url, owner, new-owner, timestamp}
 * challenge-response  {action, owner, nonce, timestamp}
 * update-endpoint     {action, url, owner, timestamp}
 * </pre>
 * {@code timestamp} is unix milliseconds as a {@code uint}.
 *
 * @param action    the action
 * @param fields    the action's field values
 * @param timestamp unix milliseconds
 * @since 0.1.0
 */
public record StructuredMessage(SignedAction action, ActionFields fields, long timestamp) {

    public StructuredMessage {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(fields, "fields");
    }

    /**
     * Builds a message, checking that every field the action needs is present.
     *
     * @throws UnknownActionException if a required field is missing or blank
     */
    public static StructuredMessage build(final SignedAction action, final ActionFields fields, final long timestamp) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(fields, "fields");
        if (timestamp < 0) {
            throw new UnknownActionException(action.tag() + ": timestamp must be non-negative");
        }
        require(action, "owner", fields.owner());
        switch (action) {
            case DELETE_ENDPOINT, UPDATE_ENDPOINT -> require(action, "url", fields.url());
            case TRANSFER_OWNERSHIP -> {
                require(action, "url", fields.url());
                require(action, "new-owner", fields.newOwner());
            }
            case CHALLENGE_RESPONSE -> require(action, "nonce", fields.nonce());
            case LIST_MY_ENDPOINTS -> {
            }
        }
        return new StructuredMessage(action, fields, timestamp);
    }

    public static StructuredMessage build(final String actionTag, final ActionFields fields, final long timestamp) {
        return build(SignedAction.fromTag(actionTag), fields, timestamp);
    }

    /**
     * @return the Clarity tuple that gets hashed and signed
     */
    public ClarityValue.Tuple toClarity() {
        final Map<String, ClarityValue> tuple = new LinkedHashMap<>();
        tuple.put("action", ClarityValue.ascii(action.tag()));
        tuple.put("owner", ClarityValue.ascii(fields.owner()));
        switch (action) {
            case DELETE_ENDPOINT, UPDATE_ENDPOINT -> tuple.put("url", ClarityValue.ascii(fields.url()));
            case TRANSFER_OWNERSHIP -> {
                tuple.put("url", ClarityValue.ascii(fields.url()));
                tuple.put("new-owner", ClarityValue.ascii(fields.newOwner()));
            }
            case CHALLENGE_RESPONSE -> tuple.put("nonce", ClarityValue.ascii(fields.nonce()));
            case LIST_MY_ENDPOINTS -> {
            }
        }
        tuple.put("timestamp", ClarityValue.uint(timestamp));
        return new ClarityValue.Tuple(tuple);
    }

    private static void require(final SignedAction action, final String name, final String value) {
        if (value == null || value.isBlank()) {
            throw new UnknownActionException(action.tag() + " requires field '" + name + "'");
        }
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.challenge;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.jspecify.annotations.Nullable;

import sh.stx402.core.crypto.sip018.ActionFields;
import sh.stx402.core.crypto.sip018.SignedAction;
import sh.stx402.core.crypto.sip018.StructuredMessage;

/**
 * A single-use nonce issued for one destructive operation by one owner.
 *
 * <p>
 * The client proves possession of the owner key by signing the
 * {@code challenge-response} message returned by {@link #responseMessage()}; its
 * timestamp is the issue time, so an aged challenge also fails the replay window.
 *
 * @param challengeId opaque identifier handed to the client
 * @param owner       canonical owner address the challenge was issued to
 * @param action      the guarded action, {@code delete-endpoint} or {@code transfer-ownership}
 * @param nonce       random hex nonce
 * @param url         normalized URL of the entry the operation targets
 * @param newOwner    transfer target, null for deletes
 * @param issuedAt    unix milliseconds
 * @param expiresAt   unix milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"challengeId", "owner", "action", "nonce", "url", "newOwner", "issuedAt", "expiresAt"})
public record Challenge(
        String challengeId,
        String owner,
        SignedAction action,
        String nonce,
        @Nullable String url,
        @Nullable String newOwner,
        long issuedAt,
        long expiresAt) {

    public Challenge {
        Objects.requireNonNull(challengeId, "challengeId");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(nonce, "nonce");
        if (expiresAt < issuedAt) {
            throw new IllegalArgumentException("expiresAt precedes issuedAt");
        }
    }

    public boolean isExpired(final Instant now) {
        return now.toEpochMilli() >= expiresAt;
    }

    /**
     * @return the message the owner signs to answer this challenge
     */
    public StructuredMessage responseMessage() {
        return StructuredMessage.build(SignedAction.CHALLENGE_RESPONSE,
                ActionFields.owner(owner).withNonce(nonce), issuedAt);
    }
}

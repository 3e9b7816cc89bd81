// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.auth;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.stx402.core.payment.PaymentOrigin;
import sh.stx402.registry.challenge.Challenge;

/**
 * Everything the engine looks at for one decision.
 *
 * @param operation    what is being attempted
 * @param claimedOwner address the caller claims to act as
 * @param entryOwner   owner of the targeted entry, null when there is none
 * @param url          normalized URL of the targeted entry
 * @param newOwner     transfer target
 * @param proof        signature proof, if any
 * @param payment      origin of the payment that funded the call
 * @param challenge    stored challenge named by the caller, if found
 */
public record AuthorizationRequest(
        Operation operation,
        String claimedOwner,
        @Nullable String entryOwner,
        @Nullable String url,
        @Nullable String newOwner,
        @Nullable SignatureProof proof,
        PaymentOrigin payment,
        @Nullable Challenge challenge) {

    public AuthorizationRequest {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(claimedOwner, "claimedOwner");
        payment = payment == null ? PaymentOrigin.NONE : payment;
    }

    public static Builder builder(final Operation operation, final String claimedOwner) {
        return new Builder(operation, claimedOwner);
    }

    public static final class Builder {
        private final Operation operation;
        private final String claimedOwner;
        private String entryOwner;
        private String url;
        private String newOwner;
        private SignatureProof proof;
        private PaymentOrigin payment = PaymentOrigin.NONE;
        private Challenge challenge;

        private Builder(final Operation operation, final String claimedOwner) {
            this.operation = operation;
            this.claimedOwner = claimedOwner;
        }

        public Builder entryOwner(final String entryOwner) {
            this.entryOwner = entryOwner;
            return this;
        }

        public Builder url(final String url) {
            this.url = url;
            return this;
        }

        public Builder newOwner(final String newOwner) {
            this.newOwner = newOwner;
            return this;
        }

        public Builder proof(final SignatureProof proof) {
            this.proof = proof;
            return this;
        }

        public Builder payment(final PaymentOrigin payment) {
            this.payment = payment;
            return this;
        }

        public Builder challenge(final Challenge challenge) {
            this.challenge = challenge;
            return this;
        }

        public AuthorizationRequest build() {
            return new AuthorizationRequest(operation, claimedOwner, entryOwner, url, newOwner, proof, payment, challenge);
        }
    }
}

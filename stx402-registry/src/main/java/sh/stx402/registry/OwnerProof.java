// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry;

import org.jspecify.annotations.Nullable;

import sh.stx402.core.payment.PaymentOrigin;

/**
 * What a caller offers to prove ownership for update and list-mine.
 *
 * @param signature     RSV hex signature, structured unless {@code simpleMessage} is set
 * @param timestamp     unix milliseconds the signature covers
 * @param simpleMessage text signed in simple mode, as built by {@link EndpointRegistry#simpleSignatureText}
 * @param payment       origin of the payment that funded the call
 */
public record OwnerProof(
        @Nullable String signature,
        @Nullable Long timestamp,
        @Nullable String simpleMessage,
        PaymentOrigin payment) {

    public static final OwnerProof NONE = new OwnerProof(null, null, null, PaymentOrigin.NONE);

    public OwnerProof {
        payment = payment == null ? PaymentOrigin.NONE : payment;
    }

    public static OwnerProof signature(final String signature, final long timestamp) {
        return new OwnerProof(signature, timestamp, null, PaymentOrigin.NONE);
    }

    public static OwnerProof simple(final String message, final long timestamp, final String signature) {
        return new OwnerProof(signature, timestamp, message, PaymentOrigin.NONE);
    }

    public static OwnerProof payment(final PaymentOrigin payment) {
        return new OwnerProof(null, null, null, payment);
    }

    public OwnerProof withPayment(final PaymentOrigin origin) {
        return new OwnerProof(signature, timestamp, simpleMessage, origin);
    }

    public boolean hasSignature() {
        return signature != null && !signature.isBlank();
    }
}

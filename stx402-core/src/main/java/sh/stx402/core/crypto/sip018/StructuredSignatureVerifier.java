// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import java.util.Objects;

/**
 * Verifies SIP-018 structured-data signatures against an expected owner.
 *
 * <p>
 * The signer is recovered from the RSV signature over the domain-bound hash and
 * compared to {@code expectedAddress} by fingerprint, so an {@code SP...} owner
 * matches a key whose address was rendered as {@code ST...}. The domain is part of
 * the hash: a signature made for another domain recovers a different key and fails.
 *
 * <p>
 * Never throws on untrusted input; every failure is a {@link VerificationResult}
 * with {@code valid=false} and an error describing it.
 *
 * @since 0.1.0
 */
public final class StructuredSignatureVerifier {

    private StructuredSignatureVerifier() {
    }

    public static VerificationResult verify(
            final StructuredMessage message,
            final Sip018Domain domain,
            final String signature,
            final String expectedAddress) {
        Objects.requireNonNull(message, "message");
        return verify(message.toClarity(), domain, signature, expectedAddress);
    }

    public static VerificationResult verify(
            final ClarityValue message,
            final Sip018Domain domain,
            final String signature,
            final String expectedAddress) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(domain, "domain");
        if (signature == null || signature.isBlank()) {
            return VerificationResult.failed("Signature is missing");
        }
        final byte[] hash = new StructuredData(domain, message).hash();
        return SignerRecovery.verify(hash, signature, expectedAddress, domain.isMainnet());
    }
}

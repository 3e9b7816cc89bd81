// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import sh.stx402.core.crypto.Sha256;

/**
 * Verifies a signature over {@code sha256(utf8(message))}, with no domain.
 *
 * <p>
 * Such a signature can be replayed in any context that accepts the same text, so
 * the registry refuses it for delete and transfer.
 *
 * @since 0.1.0
 */
public final class SimpleSignatureVerifier {

    private SimpleSignatureVerifier() {
    }

    public static VerificationResult verify(final String message, final String signature, final String expectedAddress) {
        if (message == null) {
            return VerificationResult.failed("Message is missing");
        }
        if (signature == null || signature.isBlank()) {
            return VerificationResult.failed("Signature is missing");
        }
        return SignerRecovery.verify(Sha256.hashUtf8(message), signature, expectedAddress, true);
    }
}

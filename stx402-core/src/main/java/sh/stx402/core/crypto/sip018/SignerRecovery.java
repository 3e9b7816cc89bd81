// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import java.util.Optional;

import sh.stx402.core.crypto.PrivateKey;
import sh.stx402.core.crypto.Signature;
import sh.stx402.core.types.AddressCodec;
import sh.stx402.core.types.AddressVersion;
import sh.stx402.core.types.Fingerprint;
import sh.stx402.core.types.StacksAddress;

/**
 * Shared recover-and-compare step of both verifiers.
 */
final class SignerRecovery {

    private SignerRecovery() {
    }

    /**
     * @param preferMainnet network used to render the recovered address when the
     *                      expected address cannot tell us
     */
    static VerificationResult verify(
            final byte[] hash, final String signatureHex, final String expectedAddress, final boolean preferMainnet) {
        final Signature signature;
        try {
            signature = Signature.fromRsv(signatureHex);
        } catch (IllegalArgumentException e) {
            return VerificationResult.failed("Malformed signature: " + e.getMessage());
        }

        final Fingerprint recovered;
        try {
            recovered = PrivateKey.recoverFingerprint(hash, signature);
        } catch (IllegalArgumentException e) {
            return VerificationResult.failed("Signature verification failed: " + e.getMessage());
        }

        final Optional<StacksAddress> expected = AddressCodec.tryParse(expectedAddress);
        final int version = expected
                .map(a -> a.isMainnet() ? AddressVersion.MAINNET_SINGLE_SIG : AddressVersion.TESTNET_SINGLE_SIG)
                .orElse(preferMainnet ? AddressVersion.MAINNET_SINGLE_SIG : AddressVersion.TESTNET_SINGLE_SIG);
        final String recoveredAddress = new StacksAddress(version, recovered).value();

        if (expected.isEmpty()) {
            return new VerificationResult(false, recoveredAddress, "Expected address is not a valid Stacks address");
        }
        if (!expected.get().fingerprint().equals(recovered)) {
            return VerificationResult.mismatch(recoveredAddress);
        }
        return VerificationResult.ok(recoveredAddress);
    }
}

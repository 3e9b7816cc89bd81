// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.payment;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.stx402.core.types.AddressCodec;
import sh.stx402.core.types.Fingerprint;

/**
 * Resolves the payer of the current call to a fingerprint.
 *
 * <p>
 * The explicit payer on the settlement outcome wins. Otherwise the signer hash160 is
 * read straight from the signed transaction, which avoids guessing a network version
 * to rebuild an address string. An empty result means "no proof available", never an
 * error.
 *
 * @since 0.1.0
 */
public final class PaymentOriginMatcher {

    private static final Logger log = LoggerFactory.getLogger(PaymentOriginMatcher.class);

    private PaymentOriginMatcher() {
    }

    public static Optional<Fingerprint> payerFingerprint(final PaymentOrigin origin) {
        if (origin == null) {
            return Optional.empty();
        }
        final SettlementOutcome settlement = origin.settlement();
        if (settlement != null && settlement.hasSender()) {
            final Optional<Fingerprint> fromSettlement = AddressCodec.tryFingerprint(settlement.sender());
            if (fromSettlement.isPresent()) {
                return fromSettlement;
            }
            log.debug("Settlement payer {} is not a valid address, trying signed transaction", settlement.sender());
        }
        final String txHex = origin.signedTxHex();
        if (txHex == null || txHex.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(StacksTransactionReader.read(txHex).signer());
        } catch (IllegalArgumentException e) {
            log.warn("Failed to extract payer from signed transaction: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return true iff a payer can be resolved and shares the expected address's fingerprint
     */
    public static boolean matches(final PaymentOrigin origin, final String expectedAddress) {
        final Optional<Fingerprint> expected = AddressCodec.tryFingerprint(expectedAddress);
        if (expected.isEmpty()) {
            return false;
        }
        return payerFingerprint(origin).map(expected.get()::equals).orElse(false);
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.payment;

import org.jspecify.annotations.Nullable;

/**
 * Evidence of who paid for the current call: the facilitator's settlement outcome,
 * the raw signed payment transaction, or both. Either may be {@code null}.
 *
 * @param settlement  settlement outcome reported by the facilitator
 * @param signedTxHex the signed payment transaction as hex
 * @since 0.1.0
 */
public record PaymentOrigin(@Nullable SettlementOutcome settlement, @Nullable String signedTxHex) {

    public static final PaymentOrigin NONE = new PaymentOrigin(null, null);

    public static PaymentOrigin ofSettlement(final SettlementOutcome settlement) {
        return new PaymentOrigin(settlement, null);
    }

    public static PaymentOrigin ofSignedTransaction(final String signedTxHex) {
        return new PaymentOrigin(null, signedTxHex);
    }

    public boolean isEmpty() {
        return (settlement == null || !settlement.hasSender())
                && (signedTxHex == null || signedTxHex.isBlank());
    }
}

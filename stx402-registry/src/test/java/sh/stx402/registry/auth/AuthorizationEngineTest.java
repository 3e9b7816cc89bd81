// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import sh.stx402.core.crypto.Sha256;
import sh.stx402.core.crypto.sip018.ActionFields;
import sh.stx402.core.crypto.sip018.SignedAction;
import sh.stx402.core.crypto.sip018.Sip018Domain;
import sh.stx402.core.crypto.sip018.StructuredMessage;
import sh.stx402.core.error.AuthorizationException;
import sh.stx402.core.error.DenialReason;
import sh.stx402.core.payment.PaymentOrigin;
import sh.stx402.core.payment.SettlementOutcome;
import sh.stx402.registry.MutableClock;
import sh.stx402.registry.TestKeys;
import sh.stx402.registry.challenge.Challenge;
import sh.stx402.registry.challenge.ReplayWindow;

class AuthorizationEngineTest {

    private static final String URL = "https://api.example.com/x";

    private final MutableClock clock = MutableClock.at(1_700_000_000_000L);
    private final AuthorizationEngine engine = new AuthorizationEngine(Sip018Domain.MAINNET, ReplayWindow.DEFAULT, clock);

    // register

    @Test
    void registerNeedsNoProof() {
        AuthorizationDecision decision = engine.decide(AuthorizationRequest.builder(Operation.REGISTER, TestKeys.OWNER).build());

        assertEquals(new AuthorizationDecision.Authorized(AuthMethod.OPEN), decision);
    }

    // update / list-mine

    @Test
    void updateBySignature() {
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, updateMessage(TestKeys.OWNER, clock.millis()));

        AuthorizationDecision decision = engine.decide(update(TestKeys.OWNER)
                .proof(SignatureProof.structured(updateMessage(TestKeys.OWNER, clock.millis()), sig))
                .build());

        assertEquals(new AuthorizationDecision.Authorized(AuthMethod.SIGNATURE), decision);
    }

    @Test
    void updateByPaymentFromEquivalentAddress() {
        AuthorizationDecision decision = engine.decide(update(TestKeys.OWNER)
                .payment(PaymentOrigin.ofSettlement(SettlementOutcome.withSender(TestKeys.OWNER_TESTNET)))
                .build());

        assertEquals(new AuthorizationDecision.Authorized(AuthMethod.PAYMENT), decision);
    }

    @Test
    void updateWithoutAnyProof() {
        assertDenied(DenialReason.NO_PROOF, engine.decide(update(TestKeys.OWNER).build()));
    }

    @Test
    void updateByNonOwnerClaim() {
        AuthorizationRequest request = AuthorizationRequest.builder(Operation.UPDATE, TestKeys.OTHER)
                .entryOwner(TestKeys.OWNER)
                .url(URL)
                .payment(PaymentOrigin.ofSettlement(SettlementOutcome.withSender(TestKeys.OTHER)))
                .build();

        assertDenied(DenialReason.ADDRESS_MISMATCH, engine.decide(request));
    }

    @Test
    void paymentFromSomeoneElse() {
        AuthorizationDecision decision = engine.decide(update(TestKeys.OWNER)
                .payment(PaymentOrigin.ofSettlement(SettlementOutcome.withSender(TestKeys.OTHER)))
                .build());

        assertDenied(DenialReason.ADDRESS_MISMATCH, decision);
    }

    @Test
    void unreadablePaymentCountsAsNoProof() {
        AuthorizationDecision decision = engine.decide(update(TestKeys.OWNER)
                .payment(PaymentOrigin.ofSignedTransaction("0x00"))
                .build());

        assertDenied(DenialReason.NO_PROOF, decision);
    }

    @Test
    void signatureByWrongKeyIsAddressMismatch() {
        StructuredMessage message = updateMessage(TestKeys.OWNER, clock.millis());
        String sig = TestKeys.sign(TestKeys.OTHER_KEY, message);

        assertDenied(DenialReason.ADDRESS_MISMATCH,
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.structured(message, sig)).build()));
    }

    @Test
    void malformedSignatureIsInvalid() {
        StructuredMessage message = updateMessage(TestKeys.OWNER, clock.millis());

        assertDenied(DenialReason.SIGNATURE_INVALID,
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.structured(message, "0xdead")).build()));
    }

    @Test
    void signatureForAnotherActionIsInvalid() {
        StructuredMessage listMessage = StructuredMessage.build(
                SignedAction.LIST_MY_ENDPOINTS, ActionFields.owner(TestKeys.OWNER), clock.millis());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, listMessage);

        assertDenied(DenialReason.SIGNATURE_INVALID,
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.structured(listMessage, sig)).build()));
    }

    @Test
    void signatureForAnotherUrlIsInvalid() {
        StructuredMessage message = StructuredMessage.build(SignedAction.UPDATE_ENDPOINT,
                ActionFields.owner(TestKeys.OWNER).withUrl("https://api.example.com/other"), clock.millis());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, message);

        assertDenied(DenialReason.SIGNATURE_INVALID,
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.structured(message, sig)).build()));
    }

    @Test
    void signatureFromOtherDomainDoesNotVerify() {
        StructuredMessage message = updateMessage(TestKeys.OWNER, clock.millis());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, message, Sip018Domain.TESTNET);

        AuthorizationDecision decision =
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.structured(message, sig)).build());

        assertFalse(decision.isAuthorized());
    }

    @Test
    void staleSignatureIsExpiredEvenThoughItVerifies() {
        long signedAt = clock.millis();
        StructuredMessage message = updateMessage(TestKeys.OWNER, signedAt);
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, message);
        clock.advance(Duration.ofMinutes(6));

        assertDenied(DenialReason.TIMESTAMP_EXPIRED,
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.structured(message, sig)).build()));
    }

    @Test
    void failedSignatureFallsBackToPayment() {
        StructuredMessage message = updateMessage(TestKeys.OWNER, clock.millis());
        String sig = TestKeys.sign(TestKeys.OTHER_KEY, message);

        AuthorizationDecision decision = engine.decide(update(TestKeys.OWNER)
                .proof(SignatureProof.structured(message, sig))
                .payment(PaymentOrigin.ofSettlement(SettlementOutcome.withSender(TestKeys.OWNER)))
                .build());

        assertEquals(new AuthorizationDecision.Authorized(AuthMethod.PAYMENT), decision);
    }

    @Test
    void failedSignatureReasonWinsOverFailedPayment() {
        StructuredMessage message = updateMessage(TestKeys.OWNER, clock.millis() - Duration.ofHours(1).toMillis());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, message);

        AuthorizationDecision decision = engine.decide(update(TestKeys.OWNER)
                .proof(SignatureProof.structured(message, sig))
                .payment(PaymentOrigin.ofSettlement(SettlementOutcome.withSender(TestKeys.OTHER)))
                .build());

        assertDenied(DenialReason.TIMESTAMP_EXPIRED, decision);
    }

    @Test
    void listMineBySimpleSignature() {
        String text = SignatureProof.simpleText(Sip018Domain.MAINNET, Operation.LIST_MINE, TestKeys.OWNER, null,
                clock.millis());
        String sig = TestKeys.OWNER_KEY.sign(Sha256.hashUtf8(text)).toRsvHex();

        AuthorizationDecision decision = engine.decide(AuthorizationRequest.builder(Operation.LIST_MINE, TestKeys.OWNER)
                .proof(SignatureProof.simple(text, clock.millis(), sig))
                .build());

        assertEquals(new AuthorizationDecision.Authorized(AuthMethod.SIGNATURE), decision);
    }

    @Test
    void simpleSignatureOverUnrelatedTextIsInvalid() {
        String text = "Sign in to another app";
        String sig = TestKeys.OWNER_KEY.sign(Sha256.hashUtf8(text)).toRsvHex();

        assertDenied(DenialReason.SIGNATURE_INVALID,
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.simple(text, clock.millis(), sig)).build()));
    }

    @Test
    void simpleSignatureCarriesItsTimestamp() {
        long signedAt = clock.millis();
        String text = SignatureProof.simpleText(Sip018Domain.MAINNET, Operation.UPDATE, TestKeys.OWNER, URL, signedAt);
        String sig = TestKeys.OWNER_KEY.sign(Sha256.hashUtf8(text)).toRsvHex();
        clock.advance(Duration.ofMinutes(6));

        assertDenied(DenialReason.SIGNATURE_INVALID,
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.simple(text, clock.millis(), sig)).build()));
        assertDenied(DenialReason.TIMESTAMP_EXPIRED,
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.simple(text, signedAt, sig)).build()));
    }

    @Test
    void simpleTextForOneUrlDoesNotCoverAnother() {
        String text = SignatureProof.simpleText(Sip018Domain.MAINNET, Operation.UPDATE, TestKeys.OWNER,
                "https://api.example.com/other", clock.millis());
        String sig = TestKeys.OWNER_KEY.sign(Sha256.hashUtf8(text)).toRsvHex();

        assertDenied(DenialReason.SIGNATURE_INVALID,
                engine.decide(update(TestKeys.OWNER).proof(SignatureProof.simple(text, clock.millis(), sig)).build()));
    }

    @Test
    void invalidClaimedOwner() {
        assertDenied(DenialReason.ADDRESS_MISMATCH,
                engine.decide(AuthorizationRequest.builder(Operation.LIST_MINE, "nonsense").build()));
    }

    // delete / transfer

    @Test
    void deleteWithAnsweredChallenge() {
        Challenge challenge = challenge(SignedAction.DELETE_ENDPOINT, null, clock.millis());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, challenge.responseMessage());

        AuthorizationDecision decision = engine.decide(delete(challenge, SignatureProof.challengeResponse(sig)));

        assertEquals(new AuthorizationDecision.Authorized(AuthMethod.SIGNATURE), decision);
    }

    @Test
    void deleteWithoutSignature() {
        Challenge challenge = challenge(SignedAction.DELETE_ENDPOINT, null, clock.millis());

        assertDenied(DenialReason.NO_PROOF, engine.decide(delete(challenge, null)));
    }

    @Test
    void deleteByPaymentAloneIsRefused() {
        AuthorizationRequest request = AuthorizationRequest.builder(Operation.DELETE, TestKeys.OWNER)
                .entryOwner(TestKeys.OWNER)
                .url(URL)
                .payment(PaymentOrigin.ofSettlement(SettlementOutcome.withSender(TestKeys.OWNER)))
                .build();

        assertDenied(DenialReason.NO_PROOF, engine.decide(request));
    }

    @Test
    void deleteWithSimpleSignatureIsRefused() {
        Challenge challenge = challenge(SignedAction.DELETE_ENDPOINT, null, clock.millis());
        String sig = TestKeys.OWNER_KEY.sign(Sha256.hashUtf8("delete")).toRsvHex();

        assertDenied(DenialReason.SIGNATURE_INVALID,
                engine.decide(delete(challenge, SignatureProof.simple("delete", clock.millis(), sig))));
    }

    @Test
    void deleteWithoutStoredChallenge() {
        Challenge challenge = challenge(SignedAction.DELETE_ENDPOINT, null, clock.millis());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, challenge.responseMessage());

        assertDenied(DenialReason.CHALLENGE_INVALID_OR_CONSUMED,
                engine.decide(delete(null, SignatureProof.challengeResponse(sig))));
    }

    @Test
    void deleteWithTransferChallengeIsRefused() {
        Challenge challenge = challenge(SignedAction.TRANSFER_OWNERSHIP, TestKeys.OTHER, clock.millis());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, challenge.responseMessage());

        assertDenied(DenialReason.CHALLENGE_INVALID_OR_CONSUMED,
                engine.decide(delete(challenge, SignatureProof.challengeResponse(sig))));
    }

    @Test
    void signedNonceMustMatchChallenge() {
        Challenge challenge = challenge(SignedAction.DELETE_ENDPOINT, null, clock.millis());
        StructuredMessage forged = StructuredMessage.build(SignedAction.CHALLENGE_RESPONSE,
                ActionFields.owner(TestKeys.OWNER).withNonce("00"), challenge.issuedAt());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, forged);

        assertDenied(DenialReason.CHALLENGE_INVALID_OR_CONSUMED,
                engine.decide(delete(challenge, SignatureProof.structured(forged, sig))));
    }

    @Test
    void transferWithAgedChallengeIsTimestampExpired() {
        Challenge challenge = challenge(SignedAction.TRANSFER_OWNERSHIP, TestKeys.OTHER,
                clock.millis() - Duration.ofMinutes(10).toMillis());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, challenge.responseMessage());

        AuthorizationRequest request = AuthorizationRequest.builder(Operation.TRANSFER, TestKeys.OWNER)
                .entryOwner(TestKeys.OWNER)
                .url(URL)
                .newOwner(TestKeys.OTHER)
                .challenge(challenge)
                .proof(SignatureProof.challengeResponse(sig))
                .build();

        assertDenied(DenialReason.TIMESTAMP_EXPIRED, engine.decide(request));
    }

    @Test
    void transferTargetMustMatchChallenge() {
        Challenge challenge = challenge(SignedAction.TRANSFER_OWNERSHIP, TestKeys.OTHER, clock.millis());
        String sig = TestKeys.sign(TestKeys.OWNER_KEY, challenge.responseMessage());

        AuthorizationRequest request = AuthorizationRequest.builder(Operation.TRANSFER, TestKeys.OWNER)
                .entryOwner(TestKeys.OWNER)
                .url(URL)
                .newOwner(TestKeys.STRANGER)
                .challenge(challenge)
                .proof(SignatureProof.challengeResponse(sig))
                .build();

        assertDenied(DenialReason.CHALLENGE_INVALID_OR_CONSUMED, engine.decide(request));
    }

    @Test
    void orThrowCarriesReason() {
        AuthorizationDecision decision = engine.decide(update(TestKeys.OWNER).build());

        AuthorizationException e = assertThrows(AuthorizationException.class, () -> decision.orThrow(Operation.UPDATE));
        assertEquals(DenialReason.NO_PROOF, e.reason());
        assertEquals("update", e.operation());
    }

    private static AuthorizationRequest.Builder update(String claimed) {
        return AuthorizationRequest.builder(Operation.UPDATE, claimed).entryOwner(TestKeys.OWNER).url(URL);
    }

    private static StructuredMessage updateMessage(String owner, long timestamp) {
        return StructuredMessage.build(SignedAction.UPDATE_ENDPOINT, ActionFields.owner(owner).withUrl(URL), timestamp);
    }

    private static Challenge challenge(SignedAction action, String newOwner, long issuedAt) {
        return new Challenge("c-1", TestKeys.OWNER, action, "a1b2c3d4", URL, newOwner, issuedAt,
                issuedAt + Duration.ofMinutes(5).toMillis());
    }

    private static AuthorizationRequest delete(Challenge challenge, SignatureProof proof) {
        return AuthorizationRequest.builder(Operation.DELETE, TestKeys.OWNER)
                .entryOwner(TestKeys.OWNER)
                .url(URL)
                .challenge(challenge)
                .proof(proof)
                .build();
    }

    private static void assertDenied(DenialReason expected, AuthorizationDecision decision) {
        AuthorizationDecision.Denied denied = assertInstanceOf(AuthorizationDecision.Denied.class, decision);
        assertEquals(expected, denied.reason());
        assertTrue(!decision.isAuthorized());
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.stx402.core.DebugLogger;
import sh.stx402.core.LogFormatter;
import sh.stx402.core.crypto.sip018.SignedAction;
import sh.stx402.core.crypto.sip018.SimpleSignatureVerifier;
import sh.stx402.core.crypto.sip018.Sip018Domain;
import sh.stx402.core.crypto.sip018.StructuredMessage;
import sh.stx402.core.crypto.sip018.StructuredSignatureVerifier;
import sh.stx402.core.crypto.sip018.VerificationResult;
import sh.stx402.core.error.DenialReason;
import sh.stx402.core.payment.PaymentOriginMatcher;
import sh.stx402.core.types.AddressCodec;
import sh.stx402.registry.challenge.Challenge;
import sh.stx402.registry.challenge.ReplayWindow;

/**
 * Decides whether a caller may perform a registry operation.
 *
 * <p>
 * Policy by operation:
 * <ul>
 * <li>{@code register}: always authorized; uniqueness is the store's concern.</li>
 * <li>{@code update}, {@code list-mine}: the claimed owner must be the entry's owner,
 * then either a valid signature with a fresh timestamp or a payment whose payer is
 * the owner. The signature is tried first. Simple signatures count only over the
 * text {@link SignatureProof#simpleText} builds for this request.</li>
 * <li>{@code delete}, {@code transfer}: a structured signature over an issued,
 * unexpired challenge for this owner and action, with a fresh timestamp. Payment
 * is never enough.</li>
 * </ul>
 *
 * <p>
 * The engine has no side effects besides debug logging. Consuming the challenge is
 * the caller's job once the decision is {@code Authorized}.
 */
public final class AuthorizationEngine {

    private final Sip018Domain domain;
    private final ReplayWindow window;
    private final Clock clock;

    public AuthorizationEngine(final Sip018Domain domain, final ReplayWindow window, final Clock clock) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.window = Objects.requireNonNull(window, "window");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Sip018Domain domain() {
        return domain;
    }

    public AuthorizationDecision decide(final AuthorizationRequest request) {
        Objects.requireNonNull(request, "request");
        final AuthorizationDecision decision = switch (request.operation()) {
            case REGISTER -> AuthorizationDecision.authorized(AuthMethod.OPEN);
            case UPDATE, LIST_MINE -> decideOwnerAction(request);
            case DELETE, TRANSFER -> decideChallengedAction(request);
        };
        log(request, decision);
        return decision;
    }

    private AuthorizationDecision decideOwnerAction(final AuthorizationRequest request) {
        if (!claimsEntry(request)) {
            return AuthorizationDecision.denied(DenialReason.ADDRESS_MISMATCH);
        }
        DenialReason signatureFailure = null;
        if (request.proof() != null) {
            signatureFailure = checkOwnerProof(request, request.proof());
            if (signatureFailure == null) {
                return AuthorizationDecision.authorized(AuthMethod.SIGNATURE);
            }
        }
        if (!request.payment().isEmpty()) {
            if (PaymentOriginMatcher.matches(request.payment(), request.claimedOwner())) {
                return AuthorizationDecision.authorized(AuthMethod.PAYMENT);
            }
            if (signatureFailure == null && PaymentOriginMatcher.payerFingerprint(request.payment()).isPresent()) {
                return AuthorizationDecision.denied(DenialReason.ADDRESS_MISMATCH);
            }
        }
        return AuthorizationDecision.denied(signatureFailure != null ? signatureFailure : DenialReason.NO_PROOF);
    }

    private @Nullable DenialReason checkOwnerProof(final AuthorizationRequest request, final SignatureProof proof) {
        final VerificationResult result;
        final long timestamp;
        if (proof.isSimple()) {
            final String expected = SignatureProof.simpleText(
                    domain, request.operation(), request.claimedOwner(), request.url(), proof.timestamp());
            if (!expected.equals(proof.rawMessage())) {
                return DenialReason.SIGNATURE_INVALID;
            }
            result = SimpleSignatureVerifier.verify(proof.rawMessage(), proof.signature(), request.claimedOwner());
            timestamp = proof.timestamp();
        } else {
            final StructuredMessage message = proof.message();
            if (message == null || message.action() != request.operation().action()) {
                return DenialReason.SIGNATURE_INVALID;
            }
            if (!AddressCodec.equivalent(message.fields().owner(), request.claimedOwner())) {
                return DenialReason.ADDRESS_MISMATCH;
            }
            if (request.operation() == Operation.UPDATE && !Objects.equals(message.fields().url(), request.url())) {
                return DenialReason.SIGNATURE_INVALID;
            }
            result = StructuredSignatureVerifier.verify(message, domain, proof.signature(), request.claimedOwner());
            timestamp = message.timestamp();
        }
        final DenialReason failure = verificationFailure(result);
        if (failure != null) {
            return failure;
        }
        return window.check(timestamp, now()) ? null : DenialReason.TIMESTAMP_EXPIRED;
    }

    private AuthorizationDecision decideChallengedAction(final AuthorizationRequest request) {
        if (!claimsEntry(request)) {
            return AuthorizationDecision.denied(DenialReason.ADDRESS_MISMATCH);
        }
        final SignatureProof proof = request.proof();
        if (proof == null) {
            return AuthorizationDecision.denied(DenialReason.NO_PROOF);
        }
        if (proof.isSimple()) {
            return AuthorizationDecision.denied(DenialReason.SIGNATURE_INVALID);
        }
        final Challenge challenge = request.challenge();
        if (challenge == null) {
            return AuthorizationDecision.denied(DenialReason.CHALLENGE_INVALID_OR_CONSUMED);
        }

        final StructuredMessage message = proof.message() != null ? proof.message() : challenge.responseMessage();
        final DenialReason failure = verificationFailure(
                StructuredSignatureVerifier.verify(message, domain, proof.signature(), request.claimedOwner()));
        if (failure != null) {
            return AuthorizationDecision.denied(failure);
        }
        if (!window.check(message.timestamp(), now())) {
            return AuthorizationDecision.denied(DenialReason.TIMESTAMP_EXPIRED);
        }
        if (!challengeMatches(request, challenge, message)) {
            return AuthorizationDecision.denied(DenialReason.CHALLENGE_INVALID_OR_CONSUMED);
        }
        return AuthorizationDecision.authorized(AuthMethod.SIGNATURE);
    }

    private boolean challengeMatches(
            final AuthorizationRequest request, final Challenge challenge, final StructuredMessage message) {
        if (challenge.isExpired(now())) {
            return false;
        }
        if (challenge.action() != request.operation().action()) {
            return false;
        }
        if (!AddressCodec.equivalent(challenge.owner(), request.claimedOwner())) {
            return false;
        }
        if (message.action() != SignedAction.CHALLENGE_RESPONSE
                || !challenge.nonce().equals(message.fields().nonce())
                || message.timestamp() != challenge.issuedAt()) {
            return false;
        }
        if (request.url() != null && !request.url().equals(challenge.url())) {
            return false;
        }
        return request.operation() != Operation.TRANSFER
                || AddressCodec.equivalent(challenge.newOwner(), request.newOwner());
    }

    private boolean claimsEntry(final AuthorizationRequest request) {
        if (AddressCodec.tryParse(request.claimedOwner()).isEmpty()) {
            return false;
        }
        return request.entryOwner() == null || AddressCodec.equivalent(request.claimedOwner(), request.entryOwner());
    }

    private static @Nullable DenialReason verificationFailure(final VerificationResult result) {
        if (result.valid()) {
            return null;
        }
        return result.isAddressMismatch() ? DenialReason.ADDRESS_MISMATCH : DenialReason.SIGNATURE_INVALID;
    }

    private Instant now() {
        return clock.instant();
    }

    private static void log(final AuthorizationRequest request, final AuthorizationDecision decision) {
        if (decision instanceof AuthorizationDecision.Authorized authorized) {
            DebugLogger.logAuth(LogFormatter.formatAuthGranted(
                    request.operation().label(), request.claimedOwner(), authorized.method().label()));
        } else if (decision instanceof AuthorizationDecision.Denied denied) {
            DebugLogger.logAuth(LogFormatter.formatAuthDenied(
                    request.operation().label(), request.claimedOwner(), denied.reason().description()));
        }
    }
}

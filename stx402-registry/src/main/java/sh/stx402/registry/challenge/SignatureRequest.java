// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.challenge;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import org.jspecify.annotations.Nullable;

import sh.stx402.core.crypto.Sha256;
import sh.stx402.core.crypto.sip018.ClaritySerializer;
import sh.stx402.core.crypto.sip018.Sip018Domain;
import sh.stx402.core.crypto.sip018.StructuredMessage;
import sh.stx402.primitives.Hex;

/**
 * What a client must sign: hex-encoded Clarity domain and message tuples.
 *
 * @param domain      {@code 0x}-prefixed serialized domain tuple
 * @param message     {@code 0x}-prefixed serialized message tuple
 * @param action      tag of the guarded action
 * @param timestamp   the timestamp inside {@code message}
 * @param expiresAt   unix milliseconds after which the signature is refused
 * @param challengeId challenge to send back with the signature, null when none was issued
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SignatureRequest(
        String domain,
        String message,
        String action,
        long timestamp,
        long expiresAt,
        @Nullable String challengeId) {

    private static final byte[] SIP018_PREFIX = "SIP018".getBytes(StandardCharsets.US_ASCII);

    /**
     * @return the 32-byte SIP-018 hash a wallet signs for this request
     */
    @JsonIgnore
    public byte[] signingHash() {
        return Sha256.hash(SIP018_PREFIX, Sha256.hash(Hex.decode(domain)), Sha256.hash(Hex.decode(message)));
    }

    /**
     * Signature request answering a challenge.
     */
    public static SignatureRequest forChallenge(final Challenge challenge, final Sip018Domain domain) {
        final StructuredMessage message = challenge.responseMessage();
        return new SignatureRequest(
                ClaritySerializer.toHex(domain.toClarity()),
                ClaritySerializer.toHex(message.toClarity()),
                challenge.action().tag(),
                message.timestamp(),
                challenge.expiresAt(),
                challenge.challengeId());
    }

    /**
     * Signature request for a plain owner-authenticated action.
     */
    public static SignatureRequest forMessage(
            final StructuredMessage message, final Sip018Domain domain, final long expiresAt) {
        return new SignatureRequest(
                ClaritySerializer.toHex(domain.toClarity()),
                ClaritySerializer.toHex(message.toClarity()),
                message.action().tag(),
                message.timestamp(),
                expiresAt,
                null);
    }
}

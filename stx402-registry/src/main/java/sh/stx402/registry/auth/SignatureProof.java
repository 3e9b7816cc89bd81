// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.auth;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.stx402.core.crypto.sip018.Sip018Domain;
import sh.stx402.core.crypto.sip018.StructuredMessage;

/**
 * A signature offered as proof of ownership.
 *
 * <p>
 * Structured proofs sign a SIP-018 message under the registry's domain. For
 * challenge-guarded operations the message may be omitted; it is then the
 * challenge's response message. Simple proofs sign raw text, which must be
 * exactly {@link #simpleText} for the operation, owner, URL and timestamp.
 *
 * @param signature  65-byte RSV signature, hex
 * @param message    signed structured message, null for simple proofs and bare challenge responses
 * @param rawMessage signed text of a simple proof
 * @param timestamp  unix milliseconds the proof claims
 */
public record SignatureProof(
        String signature,
        @Nullable StructuredMessage message,
        @Nullable String rawMessage,
        long timestamp) {

    public SignatureProof {
        Objects.requireNonNull(signature, "signature");
        if (message != null && rawMessage != null) {
            throw new IllegalArgumentException("A proof is either structured or simple, not both");
        }
    }

    public static SignatureProof structured(final StructuredMessage message, final String signature) {
        Objects.requireNonNull(message, "message");
        return new SignatureProof(signature, message, null, message.timestamp());
    }

    public static SignatureProof simple(final String rawMessage, final long timestamp, final String signature) {
        Objects.requireNonNull(rawMessage, "rawMessage");
        return new SignatureProof(signature, null, rawMessage, timestamp);
    }

    /**
     * A signature over a challenge's response message.
     */
    public static SignatureProof challengeResponse(final String signature) {
        return new SignatureProof(signature, null, null, 0L);
    }

    /**
     * The only text a simple proof may sign, one {@code key: value} line per field:
     *
     * <pre>
     * stx402-registry 1.0.0 chain 1
     * action: update-endpoint
     * owner: SP...
     * url: https://api.example.com/x
     * timestamp: 1700000000000
     * </pre>
     *
     * The {@code url} line is left out when {@code url} is null.
     */
    public static String simpleText(
            final Sip018Domain domain,
            final Operation operation,
            final String owner,
            final @Nullable String url,
            final long timestamp) {
        Objects.requireNonNull(domain, "domain");
        if (operation.action() == null) {
            throw new IllegalArgumentException(operation.label() + " takes no signature");
        }
        final StringBuilder text = new StringBuilder()
                .append(domain.name()).append(' ').append(domain.version())
                .append(" chain ").append(domain.chainId()).append('\n')
                .append("action: ").append(operation.action().tag()).append('\n')
                .append("owner: ").append(owner).append('\n');
        if (url != null) {
            text.append("url: ").append(url).append('\n');
        }
        return text.append("timestamp: ").append(timestamp).toString();
    }

    public boolean isSimple() {
        return rawMessage != null;
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import sh.stx402.core.crypto.PrivateKey;
import sh.stx402.core.crypto.Sha256;
import sh.stx402.core.crypto.Signature;

/**
 * A message bound to its domain, hashed per SIP-018:
 * {@code sha256("SIP018" || sha256(domain) || sha256(message))}.
 *
 * <pre>{@code
 * StructuredData data = new StructuredData(Sip018Domain.MAINNET, message.toClarity());
 * Signature sig = data.sign(key);
 * String rsv = sig.toRsvHex();
 * }</pre>
 *
 * @param domain  the domain separator
 * @param message the message value
 * @since 0.1.0
 */
public record StructuredData(Sip018Domain domain, ClarityValue message) {

    static final byte[] PREFIX = "SIP018".getBytes(StandardCharsets.US_ASCII);

    public StructuredData {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(message, "message");
    }

    public static StructuredData of(final Sip018Domain domain, final StructuredMessage message) {
        return new StructuredData(domain, message.toClarity());
    }

    /**
     * @return the 32-byte hash that is signed
     */
    public byte[] hash() {
        return Sha256.hash(encode());
    }

    /**
     * @return {@code "SIP018" || sha256(domain) || sha256(message)}
     */
    public byte[] encode() {
        final byte[] domainHash = Sha256.hash(ClaritySerializer.serialize(domain.toClarity()));
        final byte[] messageHash = Sha256.hash(ClaritySerializer.serialize(message));
        final byte[] out = new byte[PREFIX.length + 64];
        System.arraycopy(PREFIX, 0, out, 0, PREFIX.length);
        System.arraycopy(domainHash, 0, out, PREFIX.length, 32);
        System.arraycopy(messageHash, 0, out, PREFIX.length + 32, 32);
        return out;
    }

    public Signature sign(final PrivateKey key) {
        Objects.requireNonNull(key, "key");
        return key.sign(hash());
    }
}

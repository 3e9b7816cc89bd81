// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.stx402.primitives.Hex;

/**
 * Recoverable secp256k1 ECDSA signature.
 *
 * <p>
 * Stacks wallets exchange signatures in <b>RSV</b> order: 65 bytes,
 * {@code r (32) || s (32) || v (1)}, hex encoded with or without a {@code 0x}
 * prefix. The recovery byte is {@code 0}/{@code 1}; the legacy {@code 27}/{@code 28}
 * offset is also accepted.
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature
 * @param v recovery byte
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    /** Length of an RSV-encoded signature in bytes. */
    public static final int RSV_LENGTH = 65;

    private static final int MAX_BYTES_TO_DISPLAY = 8;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");

        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }

        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    /**
     * Parses an RSV hex string.
     *
     * @param hex 130 hex characters, {@code 0x} prefix optional
     * @return the signature
     * @throws IllegalArgumentException if the input is not 65 bytes of hex
     */
    public static Signature fromRsv(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        final byte[] raw = Hex.decode(hex.trim());
        if (raw.length != RSV_LENGTH) {
            throw new IllegalArgumentException("RSV signature must be " + RSV_LENGTH + " bytes, got " + raw.length);
        }
        return new Signature(
                Arrays.copyOfRange(raw, 0, 32),
                Arrays.copyOfRange(raw, 32, 64),
                raw[64] & 0xFF);
    }

    /**
     * @return the RSV encoding, lowercase hex without prefix
     */
    public String toRsvHex() {
        final byte[] raw = new byte[RSV_LENGTH];
        System.arraycopy(r, 0, raw, 0, 32);
        System.arraycopy(s, 0, raw, 32, 32);
        raw[64] = (byte) v;
        return Hex.encodeNoPrefix(raw);
    }

    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    /**
     * Extracts the recovery ID (y parity) from {@code v}.
     *
     * @return 0 or 1
     * @throws IllegalArgumentException if {@code v} is not 0, 1, 27 or 28
     */
    public int recoveryId() {
        if (v == 0 || v == 1) {
            return v;
        }
        if (v == 27 || v == 28) {
            return v - 27;
        }
        throw new IllegalArgumentException("Invalid recovery byte: " + v);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Signature other))
            return false;
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=" + bytesToHex(r) + ", s=" + bytesToHex(s) + ", v=" + v + "]";
    }

    private static String bytesToHex(byte[] bytes) {
        if (bytes.length > MAX_BYTES_TO_DISPLAY) {
            return bytes.length + " bytes";
        }
        return Hex.encodeNoPrefix(bytes);
    }
}

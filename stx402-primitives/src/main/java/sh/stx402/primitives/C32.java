// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.primitives;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Locale;

/**
 * Crockford-style base-32 ("c32") encoding and the c32check envelope used by Stacks
 * addresses.
 *
 * <p>A c32check string is {@code versionChar || c32(payload || checksum)} where the
 * checksum is the first four bytes of {@code sha256(sha256(version || payload))}.
 * A Stacks address prepends a literal {@code 'S'}.
 *
 * <h2>Leading zeros</h2>
 * <p>Each leading zero <em>byte</em> of the input is represented by exactly one
 * leading {@code '0'} character, and vice versa on decode. This matches the
 * reference implementation bit for bit, e.g. the burn address
 * {@code SP000000000000000000002Q6VF78}.
 *
 * <h2>Normalization</h2>
 * <p>Decoding is case-insensitive and maps the visually ambiguous letters
 * {@code O -> 0} and {@code I, L -> 1} before validation.
 *
 * @since 0.1.0
 */
public final class C32 {

    /** The c32 alphabet; index equals digit value. */
    public static final String ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";

    private static final BigInteger RADIX = BigInteger.valueOf(32);
    private static final int CHECKSUM_LENGTH = 4;
    private static final int MAX_VERSION = 31;

    private C32() {
        // Utility class
    }

    /**
     * Encodes bytes as c32.
     *
     * @param data bytes to encode
     * @return c32 string (empty for empty input)
     */
    public static String encode(final byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        int leadingZeros = 0;
        while (leadingZeros < data.length && data[leadingZeros] == 0) {
            leadingZeros++;
        }

        final StringBuilder digits = new StringBuilder();
        BigInteger value = new BigInteger(1, data);
        while (value.signum() > 0) {
            final BigInteger[] qr = value.divideAndRemainder(RADIX);
            digits.append(ALPHABET.charAt(qr[1].intValue()));
            value = qr[0];
        }
        for (int i = 0; i < leadingZeros; i++) {
            digits.append(ALPHABET.charAt(0));
        }
        return digits.reverse().toString();
    }

    /**
     * Decodes a c32 string.
     *
     * @param input c32 text, any case
     * @return decoded bytes
     * @throws IllegalArgumentException on characters outside the alphabet
     */
    public static byte[] decode(final String input) {
        if (input == null) {
            throw new IllegalArgumentException("c32 input cannot be null");
        }
        final String normalized = normalize(input);

        int leadingZeros = 0;
        while (leadingZeros < normalized.length() && normalized.charAt(leadingZeros) == '0') {
            leadingZeros++;
        }

        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < normalized.length(); i++) {
            final int digit = ALPHABET.indexOf(normalized.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("invalid c32 character '" + input.charAt(i) + "' in: " + input);
            }
            value = value.multiply(RADIX).add(BigInteger.valueOf(digit));
        }

        final byte[] magnitude = unsignedBytes(value);
        final byte[] result = new byte[leadingZeros + magnitude.length];
        System.arraycopy(magnitude, 0, result, leadingZeros, magnitude.length);
        return result;
    }

    /**
     * Encodes a version and payload as c32check (without the Stacks {@code 'S'} prefix).
     *
     * @param version 5-bit version (0-31)
     * @param payload payload bytes
     * @return c32check string
     */
    public static String checkEncode(final int version, final byte[] payload) {
        requireVersion(version);
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        final byte[] checksum = checksum(version, payload);
        final byte[] body = Arrays.copyOf(payload, payload.length + CHECKSUM_LENGTH);
        System.arraycopy(checksum, 0, body, payload.length, CHECKSUM_LENGTH);
        return ALPHABET.charAt(version) + encode(body);
    }

    /**
     * Decodes a c32check string (without the Stacks {@code 'S'} prefix) and verifies its checksum.
     *
     * @param input c32check text
     * @return version and payload
     * @throws IllegalArgumentException on bad characters, short input or checksum mismatch
     */
    public static Decoded checkDecode(final String input) {
        if (input == null || input.length() < 2) {
            throw new IllegalArgumentException("c32check input too short: " + input);
        }
        final String normalized = normalize(input);
        final int version = ALPHABET.indexOf(normalized.charAt(0));
        if (version < 0) {
            throw new IllegalArgumentException("invalid c32check version character in: " + input);
        }
        final byte[] body = decode(normalized.substring(1));
        if (body.length < CHECKSUM_LENGTH) {
            throw new IllegalArgumentException("c32check payload too short: " + input);
        }
        final byte[] payload = Arrays.copyOf(body, body.length - CHECKSUM_LENGTH);
        final byte[] actual = Arrays.copyOfRange(body, body.length - CHECKSUM_LENGTH, body.length);
        if (!MessageDigest.isEqual(actual, checksum(version, payload))) {
            throw new IllegalArgumentException("c32check checksum mismatch: " + input);
        }
        return new Decoded(version, payload);
    }

    /**
     * Upper-cases and maps ambiguous characters onto the alphabet.
     *
     * @param input raw text
     * @return normalized text
     */
    public static String normalize(final String input) {
        return input.toUpperCase(Locale.ROOT)
                .replace('O', '0')
                .replace('L', '1')
                .replace('I', '1');
    }

    private static byte[] checksum(final int version, final byte[] payload) {
        final MessageDigest digest = sha256();
        digest.update((byte) version);
        digest.update(payload);
        final byte[] first = digest.digest();
        return Arrays.copyOf(digest.digest(first), CHECKSUM_LENGTH);
    }

    private static byte[] unsignedBytes(final BigInteger value) {
        if (value.signum() == 0) {
            return new byte[0];
        }
        final byte[] raw = value.toByteArray();
        return raw[0] == 0 ? Arrays.copyOfRange(raw, 1, raw.length) : raw;
    }

    private static void requireVersion(final int version) {
        if (version < 0 || version > MAX_VERSION) {
            throw new IllegalArgumentException("c32check version must be in range 0-31: " + version);
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Result of {@link #checkDecode(String)}.
     *
     * @param version the 5-bit version
     * @param payload the payload bytes, checksum removed
     */
    public record Decoded(int version, byte[] payload) {

        public Decoded {
            payload = Arrays.copyOf(payload, payload.length);
        }

        @Override
        public byte[] payload() {
            return Arrays.copyOf(payload, payload.length);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Decoded other)) return false;
            return version == other.version && Arrays.equals(payload, other.payload);
        }

        @Override
        public int hashCode() {
            return 31 * version + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "Decoded[version=" + version + ", payload=" + Hex.encodeNoPrefix(payload) + "]";
        }
    }
}

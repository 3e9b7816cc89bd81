// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.types;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.stx402.core.error.InvalidAddressException;
import sh.stx402.primitives.C32;

/**
 * A Stacks account address: {@code 'S' || c32check(version, hash160)}.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with {@code S} (case-insensitive)</li>
 * <li>Body must be valid c32 with a matching checksum</li>
 * <li>Payload must be exactly 20 bytes</li>
 * </ul>
 * <p>
 * Two addresses with the same {@link #fingerprint()} under different versions
 * (e.g. {@code SP...} and {@code ST...}) identify the same key; use
 * {@link #isEquivalentTo(StacksAddress)} for ownership comparisons, not {@link #equals}.
 *
 * @param version 5-bit c32check version, see {@link AddressVersion}
 * @param fingerprint the hash160 identity
 * @since 0.1.0
 */
public record StacksAddress(int version, Fingerprint fingerprint) {

    private static final char PREFIX = 'S';
    // 'S' + version char + c32 of 24 bytes is at least 28 characters
    private static final int MIN_LENGTH = 28;
    private static final int MAX_LENGTH = 42;

    public StacksAddress {
        Objects.requireNonNull(fingerprint, "fingerprint");
        if (version < 0 || version > 31) {
            throw new IllegalArgumentException("Address version must be in range 0-31: " + version);
        }
    }

    /**
     * Parses and validates an address string.
     *
     * @param address the address text, normalized per c32 rules
     * @return the parsed address
     * @throws InvalidAddressException on any structural or checksum failure
     */
    @JsonCreator
    public static StacksAddress parse(final String address) {
        if (address == null) {
            throw new InvalidAddressException("null", "address cannot be null");
        }
        final String trimmed = address.trim();
        if (trimmed.length() < MIN_LENGTH || trimmed.length() > MAX_LENGTH) {
            throw new InvalidAddressException(address, "unexpected length " + trimmed.length());
        }
        if (Character.toUpperCase(trimmed.charAt(0)) != PREFIX) {
            throw new InvalidAddressException(address, "must start with 'S'");
        }
        final C32.Decoded decoded;
        try {
            decoded = C32.checkDecode(trimmed.substring(1));
        } catch (IllegalArgumentException e) {
            throw new InvalidAddressException(address, e.getMessage(), e);
        }
        final byte[] payload = decoded.payload();
        if (payload.length != Fingerprint.BYTE_LENGTH) {
            throw new InvalidAddressException(address, "payload must be 20 bytes, got " + payload.length);
        }
        return new StacksAddress(decoded.version(), Fingerprint.fromBytes(payload));
    }

    public static StacksAddress of(final int version, final byte[] hash160) {
        return new StacksAddress(version, Fingerprint.fromBytes(hash160));
    }

    /**
     * Re-encodes the same identity under another version.
     */
    public StacksAddress withVersion(final int newVersion) {
        return new StacksAddress(newVersion, fingerprint);
    }

    public StacksAddress mainnet() {
        return withVersion(AddressVersion.toMainnet(version));
    }

    public StacksAddress testnet() {
        return withVersion(AddressVersion.toTestnet(version));
    }

    public boolean isMainnet() {
        return AddressVersion.isMainnet(version);
    }

    public boolean isEquivalentTo(final StacksAddress other) {
        return other != null && fingerprint.equals(other.fingerprint);
    }

    /**
     * @return the canonical upper-case address string
     */
    @JsonValue
    public String value() {
        return PREFIX + C32.checkEncode(version, fingerprint.toBytes());
    }

    @Override
    public String toString() {
        return value();
    }
}

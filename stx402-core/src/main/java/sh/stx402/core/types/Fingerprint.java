// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.stx402.primitives.Hex;

/**
 * Network-independent identity of a Stacks account: the 20-byte {@code hash160}
 * of its public key (or multi-sig script).
 * <p>
 * <strong>Validation:</strong> exactly 40 hex characters, no prefix. The value is
 * stored in lowercase, so {@link #equals(Object)} is the byte-for-byte comparison.
 *
 * @since 0.1.0
 */
public record Fingerprint(@JsonValue String value) {
    public static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]{40}$");

    public Fingerprint {
        Objects.requireNonNull(value, "fingerprint");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid fingerprint: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Fingerprint of(final String value) {
        return new Fingerprint(Hex.cleanPrefix(value));
    }

    public static Fingerprint fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Fingerprint must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Fingerprint(Hex.encodeNoPrefix(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}

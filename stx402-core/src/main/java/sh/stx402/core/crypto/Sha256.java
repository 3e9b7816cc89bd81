// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 hashing utility.
 *
 * <p>
 * Used for SIP-018 structured-data hashing, simple message hashing, URL content
 * hashes and the c32check checksum.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * byte[] hash = Sha256.hash("https://api.example.com/x".getBytes(StandardCharsets.UTF_8));
 * String hashHex = Hex.encodeNoPrefix(hash);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Sha256 {

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by Java spec, this should never happen
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    });

    private Sha256() {
        // Utility class
    }

    /**
     * Computes the SHA-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes the SHA-256 hash of multiple input arrays concatenated.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Hashes the UTF-8 encoding of a string.
     *
     * @param text the text to hash
     * @return 32-byte hash
     */
    public static byte[] hashUtf8(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return hash(text.getBytes(StandardCharsets.UTF_8));
    }
}

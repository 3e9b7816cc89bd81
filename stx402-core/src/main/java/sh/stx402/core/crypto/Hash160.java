// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.RIPEMD160Digest;

/**
 * {@code ripemd160(sha256(x))}, the public-key hash embedded in Stacks addresses.
 *
 * @since 0.1.0
 */
public final class Hash160 {

    public static final int LENGTH = 20;

    private Hash160() {
    }

    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final byte[] sha = Sha256.hash(input);
        final RIPEMD160Digest ripemd = new RIPEMD160Digest();
        ripemd.update(sha, 0, sha.length);
        final byte[] out = new byte[LENGTH];
        ripemd.doFinal(out, 0);
        return out;
    }
}

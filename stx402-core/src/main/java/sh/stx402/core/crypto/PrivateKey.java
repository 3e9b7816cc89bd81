// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.stx402.core.types.AddressVersion;
import sh.stx402.core.types.Fingerprint;
import sh.stx402.core.types.StacksAddress;
import sh.stx402.primitives.Hex;

/**
 * Stacks private key with secp256k1 signing and public-key recovery.
 *
 * <p>
 * Stacks derives addresses from the <em>compressed</em> public key:
 * {@code hash160(0x02|0x03 || x)}. Keys exported by Stacks wallets carry a
 * trailing {@code 0x01} compression flag (33 bytes); {@link #fromHex(String)}
 * accepts both forms.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("753b7cc0...01");
 * StacksAddress owner = key.toAddress(AddressVersion.MAINNET_SINGLE_SIG);
 *
 * byte[] hash = Sha256.hashUtf8("hello");
 * Signature signature = key.sign(hash);
 *
 * byte[] recovered = PrivateKey.recoverPublicKey(hash, signature);
 * }</pre>
 *
 * <p>
 * Implements {@link Destroyable}: after {@link #destroy()} every operation throws
 * {@link IllegalStateException}. BigInteger is immutable, so key material can only
 * be released to the garbage collector, not zeroed.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;
    private static final byte COMPRESSED_FLAG = 0x01;
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed = false;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }

        try {
            this.privateKeyValue = new BigInteger(1, keyBytes);

            if (privateKeyValue.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (privateKeyValue.compareTo(CURVE.getN()) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }

            this.publicKey = new FixedPointCombMultiplier().multiply(CURVE.getG(), privateKeyValue).normalize();
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString 32-byte key, or 33 bytes with the trailing compression flag
     * @return private key instance
     * @throws IllegalArgumentException if hex string is invalid or key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        byte[] keyBytes = Hex.decode(hexString);
        if (keyBytes.length == PRIVATE_KEY_SIZE + 1 && keyBytes[PRIVATE_KEY_SIZE] == COMPRESSED_FLAG) {
            final byte[] trimmed = Arrays.copyOf(keyBytes, PRIVATE_KEY_SIZE);
            Arrays.fill(keyBytes, (byte) 0);
            keyBytes = trimmed;
        }
        return new PrivateKey(keyBytes);
    }

    /**
     * Creates a private key from raw bytes.
     *
     * @apiNote Takes ownership of the array and zeroes it.
     *
     * @param keyBytes 32-byte private key (will be zeroed after use)
     * @return private key instance
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes);
    }

    /**
     * @return 33-byte compressed public key
     */
    public byte[] publicKeyCompressed() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        return pubKey.getEncoded(true);
    }

    public Fingerprint fingerprint() {
        return Fingerprint.fromBytes(Hash160.hash(publicKeyCompressed()));
    }

    /**
     * Derives the single-sig address for the given version.
     *
     * @param version see {@link AddressVersion}
     */
    public StacksAddress toAddress(final int version) {
        return new StacksAddress(version, fingerprint());
    }

    /**
     * Signs a 32-byte hash using deterministic ECDSA (RFC 6979), low-s normalized.
     *
     * @param messageHash 32-byte hash
     * @return signature with v = 0 or 1
     * @throws IllegalStateException if the key has been destroyed
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return FastSigner.sign(messageHash, key);
    }

    /**
     * Recovers the compressed public key that produced {@code signature} over {@code messageHash}.
     *
     * @param messageHash 32-byte hash that was signed
     * @param signature   the signature
     * @return 33-byte compressed public key
     * @throws IllegalArgumentException if recovery fails
     */
    public static byte[] recoverPublicKey(final byte[] messageHash, final Signature signature) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");

        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes");
        }

        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());
        final int recoveryId = signature.recoveryId();

        final ECPoint point;
        try {
            point = recoverPoint(r, s, messageHash, recoveryId);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Failed to recover public key from signature", e);
        }
        if (point == null || point.isInfinity()) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        return point.getEncoded(true);
    }

    /**
     * Recovers the signer's fingerprint, i.e. {@code hash160} of the compressed public key.
     *
     * @throws IllegalArgumentException if recovery fails
     */
    public static Fingerprint recoverFingerprint(final byte[] messageHash, final Signature signature) {
        return Fingerprint.fromBytes(Hash160.hash(recoverPublicKey(messageHash, signature)));
    }

    private static ECPoint recoverPoint(
            final BigInteger r,
            final BigInteger s,
            final byte[] messageHash,
            final int recoveryId) {

        if (r.signum() <= 0 || s.signum() <= 0) {
            return null;
        }
        if (r.compareTo(CURVE.getN()) >= 0 || s.compareTo(CURVE.getN()) >= 0) {
            return null;
        }

        // R = (r, y) where y's parity matches recoveryId
        final ECPoint rPoint = decompressKey(r, (recoveryId & 1) == 1);
        if (rPoint == null || !rPoint.multiply(CURVE.getN()).isInfinity()) {
            return null;
        }

        final BigInteger e = new BigInteger(1, messageHash);

        // Q = r^-1 * (s*R - e*G)
        final BigInteger rInv = r.modInverse(CURVE.getN());
        final BigInteger srInv = rInv.multiply(s).mod(CURVE.getN());
        final BigInteger eInv = rInv.multiply(e).mod(CURVE.getN());

        final ECPoint q = rPoint.multiply(srInv).subtract(CURVE.getG().multiply(eInv));
        return q.normalize();
    }

    private static ECPoint decompressKey(final BigInteger x, final boolean yBit) {
        final ECPoint point = CURVE.getCurve().decodePoint(encodeCompressed(x, yBit));
        return point.isValid() ? point : null;
    }

    private static byte[] encodeCompressed(final BigInteger x, final boolean yBit) {
        final byte[] encoded = new byte[33];
        encoded[0] = (byte) (yBit ? 0x03 : 0x02);
        final byte[] xBytes = x.toByteArray();
        final int off = xBytes.length > 32 ? 1 : 0;
        System.arraycopy(xBytes, off, encoded, 33 - (xBytes.length - off), xBytes.length - off);
        return encoded;
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    /**
     * Never includes key bytes; shows the mainnet address instead.
     */
    @Override
    public String toString() {
        try {
            return "PrivateKey[address=" + toAddress(AddressVersion.MAINNET_SINGLE_SIG) + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }
}

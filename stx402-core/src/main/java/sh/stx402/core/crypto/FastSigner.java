// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * Deterministic (RFC 6979) secp256k1 signer that computes the recovery byte
 * directly from {@code R = k*G}.
 *
 * <p>
 * Signatures are normalized to low-s, which Stacks nodes and wallets require.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Thread-safe. Each call creates its own {@link HMacDSAKCalculator}; the shared
 * {@link FixedPointCombMultiplier} keeps no mutable state.
 */
public final class FastSigner {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private FastSigner() {
    }

    /**
     * Signs a message hash and returns the signature with recovery ID.
     *
     * @param messageHash 32-byte hash
     * @param privateKey  private key
     * @return Signature with v (0 or 1)
     */
    public static Signature sign(byte[] messageHash, BigInteger privateKey) {
        HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(CURVE.getN(), privateKey, messageHash);

        final BigInteger n = CURVE.getN();
        final BigInteger z = new BigInteger(1, messageHash);
        BigInteger r;
        BigInteger s;
        ECPoint p;

        // RFC 6979 section 3.2 step h: draw the next k until both r and s are non-zero
        do {
            BigInteger k = kCalculator.nextK();
            p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();
            r = p.getAffineXCoord().toBigInteger().mod(n);
            s = r.signum() == 0
                    ? BigInteger.ZERO
                    : k.modInverse(n).multiply(z.add(r.multiply(privateKey))).mod(n);
        } while (r.signum() == 0 || s.signum() == 0);

        int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;

        // Negating s mirrors R, so the y parity flips with it.
        if (s.compareTo(HALF_CURVE_ORDER) > 0) {
            s = n.subtract(s);
            v ^= 1;
        }

        return new Signature(toBytes32(r), toBytes32(s), v);
    }

    private static byte[] toBytes32(BigInteger value) {
        byte[] bytes = value.toByteArray();
        byte[] result = new byte[32];
        if (bytes.length == 32) {
            return bytes;
        } else if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.payment;

import java.util.Arrays;
import java.util.Objects;

import sh.stx402.core.types.AddressVersion;
import sh.stx402.core.types.Fingerprint;
import sh.stx402.core.types.StacksAddress;
import sh.stx402.primitives.Hex;

/**
 * Reads the authorization header of a serialized Stacks transaction.
 *
 * <pre>
 * offset  size  field
 * 0       1     version         0x00 mainnet, 0x80 testnet
 * 1       4     chain id
 * 5       1     auth type       0x04 standard, 0x05 sponsored
 * 6       1     hash mode       origin spending condition
 * 7       20    signer          hash160 of the origin
 * </pre>
 * In sponsored transactions the origin condition still comes first, so the signer
 * read here is the payer, not the sponsor.
 *
 * @since 0.1.0
 */
public final class StacksTransactionReader {

    public static final int AUTH_STANDARD = 0x04;
    public static final int AUTH_SPONSORED = 0x05;
    static final int VERSION_MAINNET = 0x00;
    static final int VERSION_TESTNET = 0x80;

    private static final int HEADER_LENGTH = 27;

    private StacksTransactionReader() {
    }

    /**
     * The fields read from a transaction prefix.
     *
     * @param version  transaction version byte
     * @param chainId  chain id
     * @param authType auth type byte
     * @param hashMode origin hash mode
     * @param signer   origin signer hash160
     */
    public record Header(int version, long chainId, int authType, HashMode hashMode, Fingerprint signer) {

        public boolean isMainnet() {
            return version == VERSION_MAINNET;
        }

        public boolean isSponsored() {
            return authType == AUTH_SPONSORED;
        }

        /**
         * Renders the signer as an address on the transaction's own network.
         */
        public StacksAddress signerAddress() {
            final int addressVersion;
            if (hashMode.isSingleSig()) {
                addressVersion = isMainnet() ? AddressVersion.MAINNET_SINGLE_SIG : AddressVersion.TESTNET_SINGLE_SIG;
            } else {
                addressVersion = isMainnet() ? AddressVersion.MAINNET_MULTI_SIG : AddressVersion.TESTNET_MULTI_SIG;
            }
            return new StacksAddress(addressVersion, signer);
        }
    }

    /**
     * Spending condition hash modes.
     */
    public enum HashMode {
        P2PKH(0x00, true),
        P2SH(0x01, false),
        P2WPKH(0x02, true),
        P2WSH(0x03, false),
        P2SH_NON_SEQUENTIAL(0x05, false),
        P2WSH_NON_SEQUENTIAL(0x07, false);

        private final int code;
        private final boolean singleSig;

        HashMode(final int code, final boolean singleSig) {
            this.code = code;
            this.singleSig = singleSig;
        }

        public int code() {
            return code;
        }

        public boolean isSingleSig() {
            return singleSig;
        }

        static HashMode fromCode(final int code) {
            for (HashMode mode : values()) {
                if (mode.code == code) {
                    return mode;
                }
            }
            throw new IllegalArgumentException("Unknown hash mode: 0x" + Integer.toHexString(code));
        }
    }

    /**
     * @param txHex serialized transaction, {@code 0x} prefix optional
     * @throws IllegalArgumentException if the bytes are not a Stacks transaction prefix
     */
    public static Header read(final String txHex) {
        Objects.requireNonNull(txHex, "txHex");
        return read(Hex.decode(txHex.trim()));
    }

    /**
     * @throws IllegalArgumentException if the bytes are not a Stacks transaction prefix
     */
    public static Header read(final byte[] tx) {
        Objects.requireNonNull(tx, "tx");
        if (tx.length < HEADER_LENGTH) {
            throw new IllegalArgumentException("Transaction too short: " + tx.length + " bytes");
        }
        final int version = tx[0] & 0xFF;
        if (version != VERSION_MAINNET && version != VERSION_TESTNET) {
            throw new IllegalArgumentException("Unknown transaction version: 0x" + Integer.toHexString(version));
        }
        final long chainId = ((tx[1] & 0xFFL) << 24) | ((tx[2] & 0xFFL) << 16) | ((tx[3] & 0xFFL) << 8) | (tx[4] & 0xFFL);
        final int authType = tx[5] & 0xFF;
        if (authType != AUTH_STANDARD && authType != AUTH_SPONSORED) {
            throw new IllegalArgumentException("Unknown auth type: 0x" + Integer.toHexString(authType));
        }
        final HashMode hashMode = HashMode.fromCode(tx[6] & 0xFF);
        final Fingerprint signer = Fingerprint.fromBytes(Arrays.copyOfRange(tx, 7, HEADER_LENGTH));
        return new Header(version, chainId, authType, hashMode, signer);
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.types;

/**
 * c32check version bytes of Stacks addresses.
 *
 * @since 0.1.0
 */
public final class AddressVersion {

    /** {@code SP...} */
    public static final int MAINNET_SINGLE_SIG = 22;
    /** {@code SM...} */
    public static final int MAINNET_MULTI_SIG = 20;
    /** {@code ST...} */
    public static final int TESTNET_SINGLE_SIG = 26;
    /** {@code SN...} */
    public static final int TESTNET_MULTI_SIG = 21;

    private AddressVersion() {
    }

    public static boolean isMainnet(final int version) {
        return version == MAINNET_SINGLE_SIG || version == MAINNET_MULTI_SIG;
    }

    public static boolean isTestnet(final int version) {
        return version == TESTNET_SINGLE_SIG || version == TESTNET_MULTI_SIG;
    }

    /**
     * Maps a version onto its mainnet counterpart; unknown versions are returned unchanged.
     */
    public static int toMainnet(final int version) {
        if (version == TESTNET_SINGLE_SIG) {
            return MAINNET_SINGLE_SIG;
        }
        if (version == TESTNET_MULTI_SIG) {
            return MAINNET_MULTI_SIG;
        }
        return version;
    }

    /**
     * Maps a version onto its testnet counterpart; unknown versions are returned unchanged.
     */
    public static int toTestnet(final int version) {
        if (version == MAINNET_SINGLE_SIG) {
            return TESTNET_SINGLE_SIG;
        }
        if (version == MAINNET_MULTI_SIG) {
            return TESTNET_MULTI_SIG;
        }
        return version;
    }
}

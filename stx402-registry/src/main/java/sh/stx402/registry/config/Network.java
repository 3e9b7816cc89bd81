// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.config;

import sh.stx402.core.crypto.sip018.Sip018Domain;
import sh.stx402.core.types.AddressVersion;

/**
 * The Stacks network a registry deployment serves.
 */
public enum Network {
    MAINNET,
    TESTNET;

    public Sip018Domain domain() {
        return this == MAINNET ? Sip018Domain.MAINNET : Sip018Domain.TESTNET;
    }

    public int singleSigVersion() {
        return this == MAINNET ? AddressVersion.MAINNET_SINGLE_SIG : AddressVersion.TESTNET_SINGLE_SIG;
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import java.util.Map;
import java.util.Objects;

/**
 * SIP-018 domain separator.
 *
 * <p>
 * The domain tuple {@code {name, version, chain-id}} is hashed into every
 * signature, so a message signed for testnet never verifies on mainnet.
 *
 * <pre>{@code
 * Sip018Domain domain = Sip018Domain.forNetwork(true);
 *
 * Sip018Domain custom = Sip018Domain.builder()
 *         .name("stx402-registry")
 *         .version("2.0.0")
 *         .chainId(Sip018Domain.TESTNET_CHAIN_ID)
 *         .build();
 * }</pre>
 *
 * @param name    application name
 * @param version application version
 * @param chainId Stacks chain id
 * @since 0.1.0
 */
public record Sip018Domain(String name, String version, long chainId) {

    public static final String REGISTRY_NAME = "stx402-registry";
    public static final String REGISTRY_VERSION = "1.0.0";
    public static final long MAINNET_CHAIN_ID = 1L;
    public static final long TESTNET_CHAIN_ID = 2147483648L;

    public static final Sip018Domain MAINNET = new Sip018Domain(REGISTRY_NAME, REGISTRY_VERSION, MAINNET_CHAIN_ID);
    public static final Sip018Domain TESTNET = new Sip018Domain(REGISTRY_NAME, REGISTRY_VERSION, TESTNET_CHAIN_ID);

    public Sip018Domain {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        if (chainId < 0) {
            throw new IllegalArgumentException("chainId must be non-negative: " + chainId);
        }
    }

    public static Sip018Domain forNetwork(final boolean mainnet) {
        return mainnet ? MAINNET : TESTNET;
    }

    public boolean isMainnet() {
        return chainId == MAINNET_CHAIN_ID;
    }

    public ClarityValue.Tuple toClarity() {
        return new ClarityValue.Tuple(Map.of(
                "name", ClarityValue.ascii(name),
                "version", ClarityValue.ascii(version),
                "chain-id", ClarityValue.uint(chainId)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = REGISTRY_NAME;
        private String version = REGISTRY_VERSION;
        private long chainId = MAINNET_CHAIN_ID;

        private Builder() {
        }

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder version(final String version) {
            this.version = version;
            return this;
        }

        public Builder chainId(final long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Sip018Domain build() {
            return new Sip018Domain(name, version, chainId);
        }
    }
}

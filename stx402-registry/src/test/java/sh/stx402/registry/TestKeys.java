// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry;

import sh.stx402.core.crypto.PrivateKey;
import sh.stx402.core.crypto.sip018.Sip018Domain;
import sh.stx402.core.crypto.sip018.StructuredData;
import sh.stx402.core.crypto.sip018.StructuredMessage;
import sh.stx402.core.types.AddressVersion;
import sh.stx402.registry.challenge.SignatureRequest;

/**
 * Fixed keys and signing shortcuts shared by registry tests.
 */
public final class TestKeys {

    public static final PrivateKey OWNER_KEY =
            PrivateKey.fromHex("edf9aee84d9b7abc145504dde6726c64f369d37ee34ded868fabd876c26570bc01");
    public static final String OWNER = "SPAW66WC3G8WA5F28JVNG1NTRJ6H76E7EN5H6QQD";
    public static final String OWNER_TESTNET = "STAW66WC3G8WA5F28JVNG1NTRJ6H76E7EMHDBMBN";

    public static final PrivateKey OTHER_KEY =
            PrivateKey.fromHex("0000000000000000000000000000000000000000000000000000000000000001");
    public static final String OTHER = "SP1THWXQ8368SDN2MJGE4BMDKMCHZ2GSVTS1X0BPM";

    /** An address nobody in the tests holds a key for. */
    public static final String STRANGER = "SP2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ7";

    private TestKeys() {
    }

    public static String sign(final PrivateKey key, final StructuredMessage message) {
        return sign(key, message, Sip018Domain.MAINNET);
    }

    public static String sign(final PrivateKey key, final StructuredMessage message, final Sip018Domain domain) {
        return StructuredData.of(domain, message).sign(key).toRsvHex();
    }

    public static String sign(final PrivateKey key, final SignatureRequest request) {
        return key.sign(request.signingHash()).toRsvHex();
    }

    public static String address(final PrivateKey key) {
        return key.toAddress(AddressVersion.MAINNET_SINGLE_SIG).value();
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import sh.stx402.core.crypto.Sha256;
import sh.stx402.primitives.Hex;

class SimpleSignatureVerifierTest {

    static final String SIG = "29eefa39f5746e89963bb74fc69d28224c031d8414dd8bcc7d7cf8634cbc5f20"
            + "34e341a6a3c2be26d0f361c746e2f3b98a26b389c6dbf389cf18c590c9cdcaa501";

    @Test
    void verifiesRawMessage() {
        assertTrue(SimpleSignatureVerifier.verify("hello stx402", SIG, StructuredSignatureVerifierTest.OWNER).valid());
        assertTrue(SimpleSignatureVerifier.verify(
                "hello stx402", SIG, StructuredSignatureVerifierTest.OWNER_TESTNET).valid());
    }

    @Test
    void freshSignatureVerifies() {
        String sig = StructuredSignatureVerifierTest.KEY.sign(Sha256.hashUtf8("list my endpoints")).toRsvHex();
        assertTrue(SimpleSignatureVerifier.verify("list my endpoints", sig, StructuredSignatureVerifierTest.OWNER).valid());
    }

    @Test
    void changedMessageFails() {
        assertFalse(SimpleSignatureVerifier.verify("hello stx403", SIG, StructuredSignatureVerifierTest.OWNER).valid());
        assertFalse(SimpleSignatureVerifier.verify(null, SIG, StructuredSignatureVerifierTest.OWNER).valid());
    }

    @Test
    void flippingAnySignatureBitFails() {
        byte[] raw = Hex.decode(SIG);
        for (int bit = 0; bit < 64 * 8; bit += 7) {
            byte[] tampered = raw.clone();
            tampered[bit / 8] ^= (byte) (1 << (bit % 8));
            VerificationResult result = SimpleSignatureVerifier.verify(
                    "hello stx402", Hex.encodeNoPrefix(tampered), StructuredSignatureVerifierTest.OWNER);
            assertFalse(result.valid(), "bit " + bit);
            assertNotNull(result.error());
        }
        byte[] flippedParity = raw.clone();
        flippedParity[64] ^= 1;
        assertFalse(SimpleSignatureVerifier.verify(
                "hello stx402", Hex.encodeNoPrefix(flippedParity), StructuredSignatureVerifierTest.OWNER).valid());
    }

    @Test
    void structuredSignatureIsNotASimpleSignature() {
        assertFalse(SimpleSignatureVerifier.verify("challenge-response",
                StructuredSignatureVerifierTest.KNOWN_RSV, StructuredSignatureVerifierTest.OWNER).valid());
    }
}

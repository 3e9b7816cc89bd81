// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import sh.stx402.primitives.Hex;

class Hash160Test {

    @Test
    void hashesGeneratorPublicKey() {
        byte[] pub = Hex.decode("0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798");
        assertEquals("751e76e8199196d454941c45d1b3a323f1433bd6", Hex.encodeNoPrefix(Hash160.hash(pub)));
    }

    @Test
    void sha256OfConcatenationMatchesSingleInput() {
        assertEquals(
                Hex.encodeNoPrefix(Sha256.hashUtf8("SIP018")),
                Hex.encodeNoPrefix(Sha256.hash("SIP".getBytes(), "018".getBytes())));
    }
}

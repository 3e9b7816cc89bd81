// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class C32Test {

    private static final String HASH160 = "a46ff88886c2ef9762d970b4d2c63678835bd39d";

    @Test
    void encodesReferenceVector() {
        assertEquals("MHQZH246RBQSERPSE2TD5HHPF21NQMWX", C32.encode(Hex.decode(HASH160)));
    }

    @Test
    void decodesReferenceVector() {
        assertArrayEquals(Hex.decode(HASH160), C32.decode("MHQZH246RBQSERPSE2TD5HHPF21NQMWX"));
    }

    @Test
    void leadingZeroBytesBecomeLeadingZeroCharacters() {
        assertEquals("0FZ", C32.encode(Hex.decode("0001ff")));
        assertEquals("0", C32.encode(new byte[] {0}));
        assertEquals("", C32.encode(new byte[0]));
        assertArrayEquals(Hex.decode("0001ff"), C32.decode("0FZ"));
    }

    @Test
    void checkEncodeMatchesKnownAddressBodies() {
        // Address = "S" + checkEncode(version, hash160)
        assertEquals("P2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ7", C32.checkEncode(22, Hex.decode(HASH160)));
        assertEquals("T2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKQYAC0RQ", C32.checkEncode(26, Hex.decode(HASH160)));
        assertEquals("P000000000000000000002Q6VF78", C32.checkEncode(22, new byte[20]));
    }

    @Test
    void checkDecodeRecoversVersionAndPayload() {
        C32.Decoded decoded = C32.checkDecode("P2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ7");
        assertEquals(22, decoded.version());
        assertArrayEquals(Hex.decode(HASH160), decoded.payload());
    }

    @Test
    void checkDecodeIsCaseInsensitiveAndNormalizesAmbiguousLetters() {
        C32.Decoded decoded = C32.checkDecode("p2j6zy48gv1ez5v2v5rb9mp66sw86pykknrv9ej7");
        assertEquals(22, decoded.version());

        // 'O' reads as '0'
        C32.Decoded burn = C32.checkDecode("POOOOOOOOOOOOOOOOOOOO2Q6VF78");
        assertArrayEquals(new byte[20], burn.payload());
    }

    @Test
    void checkDecodeRejectsBadChecksum() {
        assertThrows(IllegalArgumentException.class,
                () -> C32.checkDecode("P2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ8"));
    }

    @Test
    void rejectsCharactersOutsideAlphabet() {
        assertThrows(IllegalArgumentException.class, () -> C32.decode("AB#D"));
        assertThrows(IllegalArgumentException.class, () -> C32.decode("U"));
    }

    @Test
    void rejectsOutOfRangeVersion() {
        assertThrows(IllegalArgumentException.class, () -> C32.checkEncode(32, new byte[20]));
        assertThrows(IllegalArgumentException.class, () -> C32.checkEncode(-1, new byte[20]));
    }

    @Test
    void decodedRecordComparesPayloadByValue() {
        assertEquals(new C32.Decoded(22, new byte[] {1, 2}), new C32.Decoded(22, new byte[] {1, 2}));
        assertNotEquals(new C32.Decoded(22, new byte[] {1, 2}), new C32.Decoded(26, new byte[] {1, 2}));
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import sh.stx402.core.error.ErrorCode;
import sh.stx402.core.error.RegistryException;

class UrlNormalizerTest {

    @ParameterizedTest
    @CsvSource({
        "https://api.example.com/x, https://api.example.com/x",
        "HTTPS://API.Example.COM/x/, https://api.example.com/x",
        "https://api.example.com:443/x, https://api.example.com/x",
        "http://api.example.com:80, http://api.example.com/",
        "http://api.example.com:8080/a, http://api.example.com:8080/a",
        "https://api.example.com/x?b=1#frag, https://api.example.com/x?b=1",
        "'  https://api.example.com/  ', https://api.example.com/"
    })
    void normalizes(String input, String expected) {
        assertEquals(expected, UrlNormalizer.normalize(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ftp://example.com/x", "example.com/x", "https:///nohost", "not a url", " "})
    void rejectsNonHttpUrls(String input) {
        RegistryException e = assertThrows(RegistryException.class, () -> UrlNormalizer.normalize(input));
        assertEquals(ErrorCode.INVALID_INPUT, e.errorCode());
    }

    @Test
    void idIsHashPrefix() {
        String url = "https://api.example.com/x";
        String hash = UrlNormalizer.urlHash(url);

        assertEquals(64, hash.length());
        assertEquals(hash.substring(0, 16), UrlNormalizer.entryId(url));
        assertEquals("registry:url-hash:" + hash, RegistryKeys.urlPointer(url));
    }
}

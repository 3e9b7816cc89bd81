// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.kv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.stx402.core.error.ErrorCode;
import sh.stx402.core.error.RegistryException;

/**
 * JSON encoding of values held in the key-value store.
 *
 * <p>
 * Encoding is deterministic for records, so a re-encoded value can be used as the
 * expected value of a conditional write.
 */
public final class KvJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private KvJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String write(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RegistryException(ErrorCode.INVALID_INPUT,
                    "Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T read(final String key, final String json, final Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RegistryException(ErrorCode.INVALID_INPUT,
                    "Corrupt " + type.getSimpleName() + " record at " + key, e);
        }
    }
}

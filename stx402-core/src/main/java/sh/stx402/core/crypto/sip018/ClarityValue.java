// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The subset of Clarity values that signed registry messages are built from.
 *
 * <p>
 * Serialize with {@link ClaritySerializer}. Tuples keep their entries sorted by
 * name, which is the consensus ordering.
 *
 * @since 0.1.0
 */
public sealed interface ClarityValue permits ClarityValue.UInt, ClarityValue.StringAscii, ClarityValue.Tuple {

    static UInt uint(final long value) {
        return new UInt(BigInteger.valueOf(value));
    }

    static StringAscii ascii(final String value) {
        return new StringAscii(value);
    }

    /**
     * 128-bit unsigned integer.
     */
    record UInt(BigInteger value) implements ClarityValue {
        static final BigInteger MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

        public UInt {
            Objects.requireNonNull(value, "value");
            if (value.signum() < 0 || value.compareTo(MAX) > 0) {
                throw new IllegalArgumentException("uint out of range: " + value);
            }
        }
    }

    /**
     * Printable ASCII string.
     */
    record StringAscii(String value) implements ClarityValue {
        public StringAscii {
            Objects.requireNonNull(value, "value");
            if (!StandardCharsets.US_ASCII.newEncoder().canEncode(value)) {
                throw new IllegalArgumentException("string-ascii must contain only ASCII characters");
            }
        }
    }

    /**
     * Named fields, ordered by name.
     */
    record Tuple(Map<String, ClarityValue> fields) implements ClarityValue {
        public Tuple {
            Objects.requireNonNull(fields, "fields");
            final TreeMap<String, ClarityValue> sorted = new TreeMap<>();
            for (Map.Entry<String, ClarityValue> e : fields.entrySet()) {
                if (e.getKey() == null || e.getKey().isEmpty() || e.getKey().length() > 128) {
                    throw new IllegalArgumentException("invalid tuple key: " + e.getKey());
                }
                sorted.put(e.getKey(), Objects.requireNonNull(e.getValue(), "value of " + e.getKey()));
            }
            fields = Collections.unmodifiableMap(sorted);
        }

        public ClarityValue get(final String name) {
            return fields.get(name);
        }
    }
}

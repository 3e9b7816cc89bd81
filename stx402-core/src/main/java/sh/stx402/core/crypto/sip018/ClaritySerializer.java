// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import sh.stx402.primitives.Hex;

/**
 * Clarity consensus serialization for {@link ClarityValue}.
 *
 * <pre>
 * uint          0x01 || 16-byte big-endian
 * string-ascii  0x0d || u32 length || bytes
 * tuple         0x0c || u32 count || (u8 nameLength || name || value)*   names ascending
 * </pre>
 *
 * @since 0.1.0
 */
public final class ClaritySerializer {

    static final int TYPE_UINT = 0x01;
    static final int TYPE_TUPLE = 0x0c;
    static final int TYPE_STRING_ASCII = 0x0d;

    private ClaritySerializer() {
    }

    public static byte[] serialize(final ClarityValue value) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out, value);
        return out.toByteArray();
    }

    /**
     * @return serialized value as {@code 0x}-prefixed hex, the form wallets accept
     */
    public static String toHex(final ClarityValue value) {
        return Hex.encode(serialize(value));
    }

    private static void write(final ByteArrayOutputStream out, final ClarityValue value) {
        if (value instanceof ClarityValue.UInt u) {
            out.write(TYPE_UINT);
            final byte[] raw = u.value().toByteArray();
            final byte[] fixed = new byte[16];
            final int len = Math.min(raw.length, 16);
            System.arraycopy(raw, raw.length - len, fixed, 16 - len, len);
            out.writeBytes(fixed);
        } else if (value instanceof ClarityValue.StringAscii s) {
            final byte[] bytes = s.value().getBytes(StandardCharsets.US_ASCII);
            out.write(TYPE_STRING_ASCII);
            writeU32(out, bytes.length);
            out.writeBytes(bytes);
        } else if (value instanceof ClarityValue.Tuple t) {
            out.write(TYPE_TUPLE);
            writeU32(out, t.fields().size());
            for (Map.Entry<String, ClarityValue> e : t.fields().entrySet()) {
                final byte[] name = e.getKey().getBytes(StandardCharsets.US_ASCII);
                out.write(name.length);
                out.writeBytes(name);
                write(out, e.getValue());
            }
        } else {
            throw new IllegalArgumentException("Unsupported Clarity value: " + value);
        }
    }

    private static void writeU32(final ByteArrayOutputStream out, final int value) {
        out.write((value >>> 24) & 0xFF);
        out.write((value >>> 16) & 0xFF);
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
    }
}

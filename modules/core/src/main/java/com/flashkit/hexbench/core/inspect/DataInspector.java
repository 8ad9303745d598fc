package com.flashkit.hexbench.core.inspect;

import com.flashkit.hexbench.types.DataKind;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes the bytes at a cursor as each {@link DataKind}.
 *
 * <p>Numeric kinds read exactly {@link DataKind#width()} bytes in the given
 * byte order; a window that does not fit inside the buffer yields
 * {@link #UNAVAILABLE}. STRING reads up to 64 bytes, stopping at the first
 * NUL. BINARY shows the single byte at the cursor as eight bits.
 */
public class DataInspector {

    public static final String UNAVAILABLE = "-";

    public String decode(BinaryData data, long offset, DataKind kind, ByteOrder order) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(order, "order cannot be null");
        if (offset < 0 || offset >= data.size()) {
            return UNAVAILABLE;
        }
        return switch (kind) {
            case STRING -> decodeString(data.copy(offset, kind.width()));
            case BINARY -> toBits(data.get(offset));
            default -> data.contains(offset, kind.width())
                    ? decodeNumber(ByteBuffer.wrap(data.copy(offset, kind.width())).order(order), kind)
                    : UNAVAILABLE;
        };
    }

    /**
     * Every kind at once, in declaration order, for an inspector panel.
     */
    public Map<DataKind, String> decodeAll(BinaryData data, long offset, ByteOrder order) {
        Map<DataKind, String> values = new EnumMap<>(DataKind.class);
        for (DataKind kind : DataKind.values()) {
            values.put(kind, decode(data, offset, kind, order));
        }
        return values;
    }

    private static String decodeNumber(ByteBuffer window, DataKind kind) {
        return switch (kind) {
            case INT8 -> Byte.toString(window.get());
            case UINT8 -> Integer.toString(Byte.toUnsignedInt(window.get()));
            case INT16 -> Short.toString(window.getShort());
            case UINT16 -> Integer.toString(Short.toUnsignedInt(window.getShort()));
            case INT32 -> Integer.toString(window.getInt());
            case UINT32 -> Long.toString(Integer.toUnsignedLong(window.getInt()));
            case INT64 -> Long.toString(window.getLong());
            case UINT64 -> Long.toUnsignedString(window.getLong());
            case FLOAT32 -> Float.toString(window.getFloat());
            case FLOAT64 -> Double.toString(window.getDouble());
            case STRING, BINARY -> UNAVAILABLE;
        };
    }

    static String decodeString(byte[] window) {
        int end = 0;
        while (end < window.length && window[end] != 0) {
            end++;
        }
        try {
            CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(window, 0, end));
            return chars.toString();
        } catch (CharacterCodingException e) {
            StringBuilder ascii = new StringBuilder(end);
            for (int i = 0; i < end; i++) {
                ascii.append(window[i] >= 0 ? (char) window[i] : '?');
            }
            return ascii.toString();
        }
    }

    static String toBits(byte value) {
        String bits = Integer.toBinaryString(value & 0xFF);
        return "0".repeat(8 - bits.length()) + bits;
    }
}

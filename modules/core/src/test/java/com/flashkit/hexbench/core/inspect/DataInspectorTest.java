package com.flashkit.hexbench.core.inspect;

import com.flashkit.hexbench.types.DataKind;
import com.flashkit.hexbench.util.buffer.FixedBuffer;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DataInspectorTest {

    private final DataInspector inspector = new DataInspector();

    @Test
    void shouldDecodeLittleEndianIntegers() {
        var data = FixedBuffer.wrap(new byte[]{(byte) 0xFE, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});

        assertThat(inspector.decode(data, 0, DataKind.INT8, ByteOrder.LITTLE_ENDIAN)).isEqualTo("-2");
        assertThat(inspector.decode(data, 0, DataKind.UINT8, ByteOrder.LITTLE_ENDIAN)).isEqualTo("254");
        assertThat(inspector.decode(data, 0, DataKind.INT16, ByteOrder.LITTLE_ENDIAN)).isEqualTo("-2");
        assertThat(inspector.decode(data, 0, DataKind.UINT16, ByteOrder.LITTLE_ENDIAN)).isEqualTo("65534");
        assertThat(inspector.decode(data, 0, DataKind.INT32, ByteOrder.LITTLE_ENDIAN)).isEqualTo("-2");
        assertThat(inspector.decode(data, 0, DataKind.UINT32, ByteOrder.LITTLE_ENDIAN)).isEqualTo("4294967294");
    }

    @Test
    void shouldReverseWindowForBigEndian() {
        var data = FixedBuffer.wrap(new byte[]{0x12, 0x34});

        assertThat(inspector.decode(data, 0, DataKind.UINT16, ByteOrder.LITTLE_ENDIAN)).isEqualTo("13330");
        assertThat(inspector.decode(data, 0, DataKind.UINT16, ByteOrder.BIG_ENDIAN)).isEqualTo("4660");
    }

    @Test
    void shouldDecodeUnsignedSixtyFourBit() {
        byte[] ones = new byte[8];
        Arrays.fill(ones, (byte) 0xFF);
        var data = FixedBuffer.wrap(ones);

        assertThat(inspector.decode(data, 0, DataKind.UINT64, ByteOrder.LITTLE_ENDIAN))
                .isEqualTo("18446744073709551615");
        assertThat(inspector.decode(data, 0, DataKind.INT64, ByteOrder.LITTLE_ENDIAN)).isEqualTo("-1");
    }

    @Test
    void shouldDecodeFloats() {
        var data = FixedBuffer.wrap(new byte[]{0x00, 0x00, (byte) 0x80, 0x3F, 0, 0, 0, 0});

        assertThat(inspector.decode(data, 0, DataKind.FLOAT32, ByteOrder.LITTLE_ENDIAN)).isEqualTo("1.0");
        assertThat(inspector.decode(data, 0, DataKind.FLOAT64, ByteOrder.LITTLE_ENDIAN))
                .isEqualTo(Double.toString(Double.longBitsToDouble(0x3F800000L)));
    }

    @Test
    void shouldReturnSentinelWhenWindowRunsPastEnd() {
        var data = FixedBuffer.wrap(new byte[16]);

        for (DataKind kind : new DataKind[]{DataKind.INT16, DataKind.INT32, DataKind.INT64, DataKind.FLOAT64}) {
            long offset = data.size() - (kind.width() - 1);
            assertThat(inspector.decode(data, offset, kind, ByteOrder.LITTLE_ENDIAN))
                    .as(kind.name()).isEqualTo(DataInspector.UNAVAILABLE);
        }
        assertThat(inspector.decode(data, 16, DataKind.UINT8, ByteOrder.LITTLE_ENDIAN)).isEqualTo("-");
        assertThat(inspector.decode(data, -1, DataKind.BINARY, ByteOrder.LITTLE_ENDIAN)).isEqualTo("-");
    }

    @Test
    void shouldStopStringAtNul() {
        var data = FixedBuffer.wrap("kernel\0rootfs".getBytes(StandardCharsets.US_ASCII));

        assertThat(inspector.decode(data, 0, DataKind.STRING, ByteOrder.LITTLE_ENDIAN)).isEqualTo("kernel");
        assertThat(inspector.decode(data, 7, DataKind.STRING, ByteOrder.LITTLE_ENDIAN)).isEqualTo("rootfs");
    }

    @Test
    void shouldFallBackToAsciiForInvalidUtf8() {
        assertThat(DataInspector.decodeString(new byte[]{'o', 'k', (byte) 0xC3, 0x28}))
                .isEqualTo("ok?(");
    }

    @Test
    void shouldRenderBinary() {
        var data = FixedBuffer.wrap(new byte[]{0x05, (byte) 0xA0});

        assertThat(inspector.decode(data, 0, DataKind.BINARY, ByteOrder.LITTLE_ENDIAN)).isEqualTo("00000101");
        assertThat(inspector.decode(data, 1, DataKind.BINARY, ByteOrder.BIG_ENDIAN)).isEqualTo("10100000");
    }

    @Test
    void shouldDecodeAllKinds() {
        Map<DataKind, String> values = inspector.decodeAll(FixedBuffer.wrap(new byte[]{0x41, 0x42}), 0,
                ByteOrder.LITTLE_ENDIAN);

        assertThat(values).containsOnlyKeys(DataKind.values());
        assertThat(values.get(DataKind.UINT8)).isEqualTo("65");
        assertThat(values.get(DataKind.STRING)).isEqualTo("AB");
        assertThat(values.get(DataKind.INT32)).isEqualTo("-");
    }
}

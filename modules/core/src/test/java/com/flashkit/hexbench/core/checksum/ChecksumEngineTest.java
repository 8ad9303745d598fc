package com.flashkit.hexbench.core.checksum;

import com.flashkit.hexbench.util.buffer.FixedBuffer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ChecksumEngineTest {

    private final ChecksumEngine engine = new ChecksumEngine();

    private ChecksumReport compute(String ascii) {
        return engine.compute(FixedBuffer.wrap(ascii.getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void shouldMatchCheckValueVectors() {
        ChecksumReport report = compute("123456789");

        assertThat(report.crc32Hex()).isEqualTo("CBF43926");
        assertThat(report.md5()).isEqualTo("25F9E794323B453885F5181F1B624D0B");
        assertThat(report.sha1()).isEqualTo("F7C3BC1D808E04732ADF679965CCC34CA7AE3441");
        assertThat(report.sha256()).isEqualTo("15E2B0D3C33891EBB0F1EF609EC419420C20E320CE94C65FBC8C3312448EB225");
        assertThat(report.size()).isEqualTo(9);
    }

    @Test
    void shouldMatchAbcDigests() {
        ChecksumReport report = compute("abc");

        assertThat(report.md5()).isEqualTo("900150983CD24FB0D6963F7D28E17F72");
        assertThat(report.sha1()).isEqualTo("A9993E364706816ABA3E25717850C26C9CD0D89D");
        assertThat(report.sha256()).isEqualTo("BA7816BF8F01CFEA414140DE5DAE2223B00361A396177A9CB410FF61F20015AD");
    }

    @Test
    void shouldHandleEmptyBuffer() {
        ChecksumReport report = engine.compute(FixedBuffer.wrap(new byte[0]));

        assertThat(report.crc32Hex()).isEqualTo("00000000");
        assertThat(report.md5()).isEqualTo("D41D8CD98F00B204E9800998ECF8427E");
        assertThat(report.topBytes()).isEmpty();
    }

    @Test
    void shouldRankBytesByFrequencyThenValue() {
        ChecksumReport report = engine.compute(FixedBuffer.wrap(new byte[]{3, 1, 1, 2, 2, 0, 0, 0}));

        assertThat(report.topBytes()).extracting(ByteFrequency::value).containsExactly(0, 1, 2, 3);
        assertThat(report.topBytes()).extracting(ByteFrequency::count).containsExactly(3L, 2L, 2L, 1L);
        assertThat(report.topBytes().get(0).percentage()).isCloseTo(37.5, within(1e-9));
    }

    @Test
    void shouldKeepTopTwentyBuckets() {
        byte[] data = new byte[30];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }

        ChecksumReport report = engine.compute(FixedBuffer.wrap(data));

        assertThat(report.topBytes()).hasSize(ChecksumEngine.TOP_BYTES);
        assertThat(report.topBytes().get(19).value()).isEqualTo(19);
    }

    @Test
    void shouldHashAcrossChunkBoundaries() {
        byte[] data = new byte[200_000];
        data[100_000] = 1;

        ChecksumReport chunked = engine.compute(FixedBuffer.wrap(data));
        data[100_000] = 0;
        ChecksumReport zeros = engine.compute(FixedBuffer.wrap(data));

        assertThat(chunked.crc32()).isNotEqualTo(zeros.crc32());
        assertThat(chunked.topBytes()).extracting(ByteFrequency::value).containsExactly(0, 1);
    }
}

package com.flashkit.hexbench.formats.registry;

import com.flashkit.hexbench.formats.api.FileType;
import com.flashkit.hexbench.util.buffer.FixedBuffer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class FileTypeDetectorTest {

    private final FileTypeDetector detector = new FileTypeDetector();

    private static FixedBuffer withHeader(int size, int... header) {
        byte[] data = new byte[size];
        for (int i = 0; i < header.length; i++) {
            data[i] = (byte) header[i];
        }
        return FixedBuffer.wrap(data);
    }

    @Test
    void shouldDetectZip() {
        assertThat(detector.detect(withHeader(64, 0x50, 0x4B, 0x03, 0x04))).isEqualTo(FileType.ZIP);
    }

    @Test
    void shouldIgnoreMagicInBuffersShorterThanEightBytes() {
        assertThat(detector.detect(withHeader(4, 0x50, 0x4B, 0x03, 0x04))).isEqualTo(FileType.BINARY);
        assertThat(detector.detect(withHeader(4, 0x7F, 0x45, 0x4C, 0x46))).isEqualTo(FileType.TEXT);
        assertThat(detector.detect(withHeader(7, 0xFF, 0xD8, 0xFF, 0x41, 0x41, 0x41, 0x41))).isEqualTo(FileType.TEXT);
    }

    @Test
    void shouldDetectMagicAtExactlyEightBytes() {
        assertThat(detector.detect(withHeader(8, 0x50, 0x4B, 0x03, 0x04))).isEqualTo(FileType.ZIP);
    }

    @Test
    void shouldDetectElf() {
        assertThat(detector.detect(withHeader(64, 0x7F, 0x45, 0x4C, 0x46))).isEqualTo(FileType.ELF);
    }

    @Test
    void shouldDetectAndroidBootImage() {
        byte[] data = Arrays.copyOf("ANDROID!".getBytes(StandardCharsets.US_ASCII), 2048);
        assertThat(detector.detect(FixedBuffer.wrap(data))).isEqualTo(FileType.ANDROID_BOOT_IMAGE);
    }

    @Test
    void shouldDetectSparsePngAndJpeg() {
        assertThat(detector.detect(withHeader(16, 0x3A, 0xFF, 0x26, 0xED))).isEqualTo(FileType.SPARSE_IMAGE);
        assertThat(detector.detect(withHeader(16, 0x89, 0x50, 0x4E, 0x47))).isEqualTo(FileType.PNG);
        assertThat(detector.detect(withHeader(16, 0xFF, 0xD8, 0xFF, 0xE0))).isEqualTo(FileType.JPEG);
    }

    @Test
    void shouldClassifyPrintableContentAsText() {
        byte[] text = "line one\r\n\tline two\u001b[0m\n".getBytes(StandardCharsets.US_ASCII);
        assertThat(detector.detect(FixedBuffer.wrap(text))).isEqualTo(FileType.TEXT);
    }

    @Test
    void shouldClassifyControlBytesAsBinary() {
        assertThat(detector.detect(withHeader(64, 0x41, 0x42, 0x00))).isEqualTo(FileType.BINARY);
        assertThat(detector.detect(withHeader(64, 0x41, 0x10))).isEqualTo(FileType.BINARY);
    }

    @Test
    void shouldOnlySampleFirstThousandBytes() {
        byte[] data = new byte[2000];
        Arrays.fill(data, (byte) 'a');
        data[1500] = 0x00;

        assertThat(detector.detect(FixedBuffer.wrap(data))).isEqualTo(FileType.TEXT);
    }

    @Test
    void shouldReportTinyBuffersAsUnknown() {
        assertThat(detector.detect(withHeader(3, 0xFF, 0xD8, 0xFF))).isEqualTo(FileType.UNKNOWN);
        assertThat(detector.detect(FixedBuffer.wrap(new byte[0]))).isEqualTo(FileType.UNKNOWN);
    }
}

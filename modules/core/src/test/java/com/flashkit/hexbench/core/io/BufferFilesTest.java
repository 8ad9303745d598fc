package com.flashkit.hexbench.core.io;

import com.flashkit.hexbench.core.edit.EditBuffer;
import com.flashkit.hexbench.core.edit.EditEngine;
import com.flashkit.hexbench.core.result.Outcome;
import com.flashkit.hexbench.types.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

class BufferFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRoundTripThroughDisk() throws Exception {
        byte[] content = {0x7F, 'E', 'L', 'F', 2, 1, 1, 0};
        Path file = tempDir.resolve("image.bin");
        Files.write(file, content);
        BufferFiles files = new BufferFiles();

        EditBuffer loaded = files.load(file, LargeFileGate.NEVER).orElseThrow();
        new EditEngine(loaded, 10).writeByte(7, (byte) 0x42);
        Path copy = tempDir.resolve("out/copy.bin");

        assertThat(files.save(loaded, copy).isOk()).isTrue();
        assertThat(loaded.isDirty()).isFalse();
        EditBuffer reloaded = files.load(copy, LargeFileGate.NEVER).orElseThrow();
        assertThat(reloaded.snapshot()).isEqualTo(loaded.snapshot());
        assertThat(reloaded.get(7)).isEqualTo((byte) 0x42);
    }

    @Test
    void shouldReportMissingFile() {
        Outcome<EditBuffer> result = new BufferFiles().load(tempDir.resolve("missing.img"), LargeFileGate.ALWAYS);

        assertThat(result.failure()).hasValueSatisfying(e ->
                assertThat(e.kind()).isEqualTo(ErrorKind.FILE_NOT_FOUND));
    }

    @Test
    void shouldAskGateAboveThreshold() throws Exception {
        Path file = tempDir.resolve("big.img");
        Files.write(file, new byte[64]);
        AtomicLong askedSize = new AtomicLong(-1);

        Outcome<EditBuffer> declined = new BufferFiles(32).load(file, (path, size) -> {
            askedSize.set(size);
            return false;
        });

        assertThat(askedSize.get()).isEqualTo(64);
        assertThat(declined.failure()).hasValueSatisfying(e ->
                assertThat(e.kind()).isEqualTo(ErrorKind.CANCELLED));
        assertThat(new BufferFiles(32).load(file, LargeFileGate.ALWAYS).isOk()).isTrue();
    }

    @Test
    void shouldNotAskGateAtThreshold() throws Exception {
        Path file = tempDir.resolve("edge.img");
        Files.write(file, new byte[32]);

        assertThat(new BufferFiles(32).load(file, LargeFileGate.NEVER).isOk()).isTrue();
    }

    @Test
    void shouldSaveRangeWithoutCleaningBuffer() throws Exception {
        EditBuffer buffer = EditBuffer.of(new byte[]{1, 2, 3, 4, 5});
        new EditEngine(buffer, 10).writeByte(0, (byte) 9);
        Path target = tempDir.resolve("slice.bin");

        assertThat(new BufferFiles().saveRange(buffer, 3, 10, target).isOk()).isTrue();

        assertThat(Files.readAllBytes(target)).containsExactly(4, 5);
        assertThat(buffer.isDirty()).isTrue();
    }

    @Test
    void shouldReportWriteFailure() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file, not a directory");

        Outcome<Void> result = new BufferFiles().save(EditBuffer.of(new byte[4]), blocker.resolve("out.bin"));

        assertThat(result.failure()).hasValueSatisfying(e ->
                assertThat(e.kind()).isEqualTo(ErrorKind.IO_FAILURE));
    }
}

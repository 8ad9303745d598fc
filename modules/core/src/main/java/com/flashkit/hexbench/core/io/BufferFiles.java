package com.flashkit.hexbench.core.io;

import com.flashkit.hexbench.core.edit.EditBuffer;
import com.flashkit.hexbench.core.result.EditorError;
import com.flashkit.hexbench.core.result.Outcome;
import com.flashkit.hexbench.types.ErrorKind;
import com.flashkit.hexbench.util.FileSizes;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Whole-file load and save. The buffer on disk is always a byte-for-byte
 * mirror of the buffer in memory.
 */
public class BufferFiles {

    private static final Logger log = Logger.getLogger(BufferFiles.class);

    public static final long DEFAULT_CONFIRM_THRESHOLD = 500L * 1024 * 1024;

    private final long confirmThreshold;

    public BufferFiles(long confirmThreshold) {
        if (confirmThreshold < 0) {
            throw new IllegalArgumentException("confirmThreshold must be >= 0, got: " + confirmThreshold);
        }
        this.confirmThreshold = confirmThreshold;
    }

    public BufferFiles() {
        this(DEFAULT_CONFIRM_THRESHOLD);
    }

    /**
     * Reads the whole file into a new buffer. Files above the confirm threshold
     * are only read when the gate agrees.
     */
    public Outcome<EditBuffer> load(Path path, LargeFileGate gate) {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(gate, "gate cannot be null");
        try {
            long size = Files.size(path);
            if (size > Integer.MAX_VALUE - 8) {
                return Outcome.failed(ErrorKind.IO_FAILURE,
                        "File too large to edit in memory: " + path + " (" + FileSizes.format(size) + ")");
            }
            if (size > confirmThreshold && !gate.confirm(path, size)) {
                log.debugf("Load of %s (%d bytes) declined", path, size);
                return Outcome.failed(ErrorKind.CANCELLED, "Load cancelled: " + path);
            }
            byte[] content = Files.readAllBytes(path);
            log.debugf("Loaded %s (%d bytes)", path, content.length);
            return Outcome.ok(EditBuffer.of(content));
        } catch (NoSuchFileException e) {
            return Outcome.failed(ErrorKind.FILE_NOT_FOUND, "File not found: " + path);
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo("loading", path, e));
        }
    }

    /**
     * Writes the full buffer to {@code path}, replacing any existing file,
     * and marks the buffer clean.
     */
    public Outcome<Void> save(EditBuffer buffer, Path path) {
        Objects.requireNonNull(buffer, "buffer cannot be null");
        Outcome<Void> written = writeBytes(buffer.snapshot(), path, "saving");
        if (written.isOk()) {
            buffer.markSaved();
            log.debugf("Saved %s (%d bytes)", path, buffer.size());
        }
        return written;
    }

    /**
     * Writes {@code length} bytes of the buffer starting at {@code offset}, clipped at the end.
     * Does not touch the dirty state.
     */
    public Outcome<Void> saveRange(EditBuffer buffer, long offset, int length, Path path) {
        Objects.requireNonNull(buffer, "buffer cannot be null");
        if (!buffer.inRange(offset) || length <= 0) {
            return Outcome.failed(ErrorKind.OUT_OF_RANGE, "Nothing selected at offset " + offset);
        }
        return writeBytes(buffer.data().copy(offset, length), path, "exporting");
    }

    private static Outcome<Void> writeBytes(byte[] bytes, Path path, String action) {
        Objects.requireNonNull(path, "path cannot be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, bytes);
            return Outcome.done();
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo(action, path, e));
        }
    }

    public long confirmThreshold() {
        return confirmThreshold;
    }
}

package com.flashkit.hexbench.core.display;

import com.flashkit.hexbench.core.edit.EditBuffer;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Splits a buffer into fixed-width display rows.
 */
public class HexLines {

    public static final int DEFAULT_BYTES_PER_LINE = 16;

    private final int bytesPerLine;

    public HexLines(int bytesPerLine) {
        if (bytesPerLine <= 0) {
            throw new IllegalArgumentException("bytesPerLine must be > 0, got: " + bytesPerLine);
        }
        this.bytesPerLine = bytesPerLine;
    }

    public int bytesPerLine() {
        return bytesPerLine;
    }

    public long lineCount(long size) {
        return (size + bytesPerLine - 1) / bytesPerLine;
    }

    public long lineOf(long offset) {
        return offset / bytesPerLine;
    }

    /**
     * Rows {@code first .. first+count-1}, stopping at the end of the buffer.
     */
    public List<HexLine> lines(EditBuffer buffer, long first, int count) {
        List<HexLine> rows = new ArrayList<>();
        long total = lineCount(buffer.size());
        for (long line = Math.max(0, first); line < total && rows.size() < count; line++) {
            rows.add(line(buffer, line));
        }
        return rows;
    }

    public HexLine line(EditBuffer buffer, long line) {
        long offset = line * bytesPerLine;
        byte[] bytes = buffer.data().copy(offset, bytesPerLine);
        BitSet modified = new BitSet(bytes.length);
        for (long m : buffer.modifiedOffsets().subSet(offset, offset + bytes.length)) {
            modified.set((int) (m - offset));
        }
        return new HexLine(offset, bytes, modified);
    }

    /**
     * Unmarked rows over read-only data, for exports.
     */
    public List<HexLine> lines(BinaryData data) {
        List<HexLine> rows = new ArrayList<>();
        for (long offset = 0; offset < data.size(); offset += bytesPerLine) {
            rows.add(new HexLine(offset, data.copy(offset, bytesPerLine), null));
        }
        return rows;
    }
}

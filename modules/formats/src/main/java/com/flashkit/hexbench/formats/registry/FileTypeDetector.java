package com.flashkit.hexbench.formats.registry;

import com.flashkit.hexbench.formats.api.FileType;
import com.flashkit.hexbench.formats.api.Signature;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.util.Map;

/**
 * Classifies a buffer by its leading magic bytes, falling back to a
 * text-versus-binary heuristic over the first bytes. Buffers shorter than
 * eight bytes skip the magic check.
 */
public class FileTypeDetector {

    /** Bytes sampled by the text heuristic. */
    static final int TEXT_SAMPLE_SIZE = 1000;

    private static final int MIN_SIZE = 4;

    /** Shortest buffer the signature table is consulted for. */
    static final int MIN_SIGNATURE_SIZE = 8;

    public FileType detect(BinaryData data) {
        if (data.size() < MIN_SIZE) {
            return FileType.UNKNOWN;
        }

        if (data.size() >= MIN_SIGNATURE_SIZE) {
            for (Map.Entry<FileType, Signature> entry : SignatureTable.FILE_TYPES.entrySet()) {
                if (entry.getValue().matches(data, 0)) {
                    return entry.getKey();
                }
            }
        }

        return looksLikeText(data) ? FileType.TEXT : FileType.BINARY;
    }

    /**
     * Text unless the sample holds a control character other than
     * TAB, LF, VT, FF, CR or ESC.
     */
    static boolean looksLikeText(BinaryData data) {
        long limit = Math.min(TEXT_SAMPLE_SIZE, data.size());
        for (long i = 0; i < limit; i++) {
            int b = data.getUnsigned(i);
            if (b < 0x09 || (b > 0x0D && b < 0x20 && b != 0x1B)) {
                return false;
            }
        }
        return true;
    }
}

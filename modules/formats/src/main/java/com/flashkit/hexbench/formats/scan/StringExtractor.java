package com.flashkit.hexbench.formats.scan;

import com.flashkit.hexbench.formats.api.Capped;
import com.flashkit.hexbench.formats.api.StringMatch;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts runs of printable ASCII (0x20-0x7E), like the Unix {@code strings} tool.
 */
public class StringExtractor {

    static final int PREVIEW_LENGTH = 50;

    private final int maxResults;

    public StringExtractor(int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0, got: " + maxResults);
        }
        this.maxResults = maxResults;
    }

    public Capped<StringMatch> extract(BinaryData data, int minLength) {
        if (minLength <= 0) {
            throw new IllegalArgumentException("minLength must be > 0, got: " + minLength);
        }

        List<StringMatch> matches = new ArrayList<>();
        StringBuilder preview = new StringBuilder(PREVIEW_LENGTH);
        long runStart = -1;
        long size = data.size();

        for (long i = 0; i <= size; i++) {
            int b = i < size ? data.getUnsigned(i) : -1;
            if (b >= 0x20 && b <= 0x7E) {
                if (runStart < 0) {
                    runStart = i;
                    preview.setLength(0);
                }
                if (preview.length() < PREVIEW_LENGTH) {
                    preview.append((char) b);
                }
                continue;
            }

            if (runStart >= 0) {
                int length = (int) (i - runStart);
                if (length >= minLength) {
                    String text = length > PREVIEW_LENGTH ? preview + "..." : preview.toString();
                    matches.add(new StringMatch(runStart, length, text));
                    if (matches.size() >= maxResults) {
                        return new Capped<>(matches, i < size);
                    }
                }
                runStart = -1;
            }
        }

        return new Capped<>(matches, false);
    }
}

package com.flashkit.hexbench.formats.scan;

import com.flashkit.hexbench.formats.api.Capped;
import com.flashkit.hexbench.formats.api.PatternHit;
import com.flashkit.hexbench.formats.api.Signature;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every occurrence of a set of well-known magics, at any offset.
 * Hits are grouped by pattern in table order, then by offset.
 */
public class KnownPatternFinder {

    private final List<Signature> patterns;
    private final int maxResults;

    public KnownPatternFinder(List<Signature> patterns, int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0, got: " + maxResults);
        }
        this.patterns = List.copyOf(patterns);
        this.maxResults = maxResults;
    }

    public Capped<PatternHit> find(BinaryData data) {
        List<PatternHit> hits = new ArrayList<>();
        long size = data.size();

        for (Signature pattern : patterns) {
            for (long pos = 0; pos + pattern.length() <= size; pos++) {
                if (pattern.matches(data, pos)) {
                    if (hits.size() == maxResults) {
                        return new Capped<>(hits, true);
                    }
                    hits.add(new PatternHit(pos, pattern.length(), pattern.name()));
                }
            }
        }

        return new Capped<>(hits, false);
    }
}

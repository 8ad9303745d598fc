package com.flashkit.hexbench.core.search;

import com.flashkit.hexbench.core.edit.EditEngine;
import com.flashkit.hexbench.util.HexText;
import com.flashkit.hexbench.util.buffer.BinaryData;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Exact substring search over a buffer, and equal-length replacement of the hits.
 */
public class PatternMatcher {

    public static final int DEFAULT_MAX_RESULTS = 1000;
    static final int PREVIEW_BYTES = 16;

    private final int maxResults;

    public PatternMatcher(int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0, got: " + maxResults);
        }
        this.maxResults = maxResults;
    }

    public PatternMatcher() {
        this(DEFAULT_MAX_RESULTS);
    }

    public SearchResults search(BinaryData data, String text) {
        return search(data, SearchQuery.parse(text));
    }

    /**
     * Slides the pattern over every offset, collecting matches in ascending order
     * until the cap is reached. Overlapping matches are all reported.
     */
    public SearchResults search(BinaryData data, SearchQuery query) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(query, "query cannot be null");
        if (query.isEmpty()) {
            return new SearchResults(query, List.of(), false);
        }
        byte[] pattern = query.pattern();
        long last = data.size() - pattern.length;
        List<SearchResult> hits = new ArrayList<>();
        boolean truncated = false;
        for (long pos = 0; pos <= last; pos++) {
            if (data.matchesAt(pos, pattern)) {
                if (hits.size() == maxResults) {
                    truncated = true;
                    break;
                }
                hits.add(new SearchResult(pos, pattern.length,
                        HexText.toSpacedHex(data.copy(pos, PREVIEW_BYTES))));
            }
        }
        return new SearchResults(query, hits, truncated);
    }

    /**
     * Overwrites every hit whose length equals the replacement, highest offset first.
     * All replacements land in a single undoable action spanning the lowest to the
     * highest changed hit, so one undo reverts the whole operation.
     *
     * @return number of hits actually changed
     */
    public int replaceAll(EditEngine engine, SearchResults results, byte[] replacement) {
        Objects.requireNonNull(engine, "engine cannot be null");
        Objects.requireNonNull(replacement, "replacement cannot be null");
        List<SearchResult> targets = new ArrayList<>();
        for (SearchResult hit : results.results()) {
            if (hit.length() == replacement.length && replacement.length > 0
                    && engine.buffer().data().contains(hit.offset(), hit.length())) {
                targets.add(hit);
            }
        }
        if (targets.isEmpty()) {
            return 0;
        }
        targets.sort(Comparator.comparingLong(SearchResult::offset).reversed());

        long start = targets.get(targets.size() - 1).offset();
        long end = targets.get(0).offset() + replacement.length;
        byte[] span = engine.buffer().data().copy(start, (int) (end - start));
        int replaced = 0;
        for (SearchResult hit : targets) {
            int at = (int) (hit.offset() - start);
            if (!Arrays.equals(span, at, at + replacement.length, replacement, 0, replacement.length)) {
                System.arraycopy(replacement, 0, span, at, replacement.length);
                replaced++;
            }
        }
        if (replaced > 0) {
            engine.writeBytes(start, span);
        }
        return replaced;
    }

    public int maxResults() {
        return maxResults;
    }
}

package com.flashkit.hexbench.core.search;

import java.util.List;
import java.util.Optional;

/**
 * Ordered matches of the last search plus the navigation cursor used by
 * find-next and find-previous. The cursor starts before the first match.
 */
public class SearchResults {

    private static final SearchResults EMPTY = new SearchResults(null, List.of(), false);

    private final SearchQuery query;
    private final List<SearchResult> results;
    private final boolean truncated;
    private int current = -1;

    public SearchResults(SearchQuery query, List<SearchResult> results, boolean truncated) {
        this.query = query;
        this.results = List.copyOf(results);
        this.truncated = truncated;
    }

    public static SearchResults empty() {
        return EMPTY;
    }

    /**
     * The query that produced these results, or null for the empty set.
     */
    public SearchQuery query() {
        return query;
    }

    public List<SearchResult> results() {
        return results;
    }

    /**
     * True when the scan stopped at the result cap.
     */
    public boolean truncated() {
        return truncated;
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    /**
     * Index of the match last selected, or -1 before any navigation.
     */
    public int currentIndex() {
        return current;
    }

    public Optional<SearchResult> next() {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        current = (current + 1) % results.size();
        return Optional.of(results.get(current));
    }

    public Optional<SearchResult> previous() {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        current = current <= 0 ? results.size() - 1 : current - 1;
        return Optional.of(results.get(current));
    }
}

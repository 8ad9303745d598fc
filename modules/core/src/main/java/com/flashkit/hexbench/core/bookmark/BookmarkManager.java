package com.flashkit.hexbench.core.bookmark;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of bookmarks, in insertion order. Several bookmarks may share an offset.
 *
 * <p>Bookmarks are identified by instance, not by value, so two identical
 * entries can still be removed or renamed one at a time.
 */
public class BookmarkManager {

    private final List<Bookmark> bookmarks = new ArrayList<>();
    private final Clock clock;

    public BookmarkManager(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public BookmarkManager() {
        this(Clock.systemUTC());
    }

    public Bookmark add(String name, long offset, String description) {
        Bookmark bookmark = new Bookmark(name, offset, description, clock.instant());
        bookmarks.add(bookmark);
        return bookmark;
    }

    /**
     * Appends previously saved bookmarks, keeping their timestamps.
     */
    public void addAll(Collection<Bookmark> restored) {
        restored.forEach(b -> bookmarks.add(Objects.requireNonNull(b, "bookmark cannot be null")));
    }

    /**
     * Replaces the given bookmark with a renamed copy in the same position.
     *
     * @return the renamed bookmark, or empty if the bookmark is not in this list
     */
    public Optional<Bookmark> rename(Bookmark bookmark, String newName) {
        int index = indexOf(bookmark);
        if (index < 0) {
            return Optional.empty();
        }
        Bookmark renamed = bookmark.withName(newName);
        bookmarks.set(index, renamed);
        return Optional.of(renamed);
    }

    public boolean remove(Bookmark bookmark) {
        int index = indexOf(bookmark);
        if (index < 0) {
            return false;
        }
        bookmarks.remove(index);
        return true;
    }

    public List<Bookmark> list() {
        return Collections.unmodifiableList(bookmarks);
    }

    public List<Bookmark> findByName(String name) {
        return bookmarks.stream().filter(b -> b.name().equals(name)).toList();
    }

    /**
     * Bookmark with the smallest offset strictly after {@code cursor}.
     * Among bookmarks sharing that offset, the earliest added wins.
     */
    public Optional<Bookmark> next(long cursor) {
        Bookmark best = null;
        for (Bookmark b : bookmarks) {
            if (b.offset() > cursor && (best == null || b.offset() < best.offset())) {
                best = b;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Bookmark with the largest offset strictly before {@code cursor}.
     */
    public Optional<Bookmark> previous(long cursor) {
        Bookmark best = null;
        for (Bookmark b : bookmarks) {
            if (b.offset() < cursor && (best == null || b.offset() > best.offset())) {
                best = b;
            }
        }
        return Optional.ofNullable(best);
    }

    public int size() {
        return bookmarks.size();
    }

    public boolean isEmpty() {
        return bookmarks.isEmpty();
    }

    public void clear() {
        bookmarks.clear();
    }

    private int indexOf(Bookmark bookmark) {
        for (int i = 0; i < bookmarks.size(); i++) {
            if (bookmarks.get(i) == bookmark) {
                return i;
            }
        }
        return -1;
    }
}

package com.flashkit.hexbench.core.io;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Most-recently-opened files, newest first, persisted as one path per line.
 *
 * <p>Entries whose file no longer exists are dropped when the list is loaded.
 * Persistence failures are logged and otherwise ignored: the list is a
 * convenience, never a reason to fail an open.
 */
public class RecentFiles {

    private static final Logger log = Logger.getLogger(RecentFiles.class);

    public static final int DEFAULT_MAX_ENTRIES = 10;

    private final Path store;
    private final int maxEntries;
    private final List<Path> entries = new ArrayList<>();

    public RecentFiles(Path store, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got: " + maxEntries);
        }
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.maxEntries = maxEntries;
    }

    /**
     * Reads the persisted list, dropping stale and duplicate entries.
     */
    public RecentFiles load() {
        entries.clear();
        if (!Files.exists(store)) {
            return this;
        }
        try {
            for (String line : Files.readAllLines(store, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                Path path = Path.of(trimmed);
                if (Files.exists(path) && !entries.contains(path) && entries.size() < maxEntries) {
                    entries.add(path);
                }
            }
        } catch (IOException e) {
            log.warnf(e, "Could not read recent files from %s", store);
        }
        return this;
    }

    /**
     * Moves {@code path} to the front of the list and persists it.
     */
    public void add(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        entries.remove(normalized);
        entries.add(0, normalized);
        while (entries.size() > maxEntries) {
            entries.remove(entries.size() - 1);
        }
        persist();
    }

    public void clear() {
        entries.clear();
        persist();
    }

    public List<Path> entries() {
        return Collections.unmodifiableList(entries);
    }

    private void persist() {
        List<String> lines = entries.stream().map(Path::toString).toList();
        try {
            Path parent = store.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(store, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warnf(e, "Could not write recent files to %s", store);
        }
    }
}

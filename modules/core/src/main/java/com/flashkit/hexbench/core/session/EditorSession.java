package com.flashkit.hexbench.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flashkit.hexbench.core.bookmark.Bookmark;
import com.flashkit.hexbench.core.bookmark.BookmarkManager;
import com.flashkit.hexbench.core.bookmark.BookmarkStore;
import com.flashkit.hexbench.core.checksum.ChecksumEngine;
import com.flashkit.hexbench.core.checksum.ChecksumReport;
import com.flashkit.hexbench.core.config.EditorSettings;
import com.flashkit.hexbench.core.display.HexLine;
import com.flashkit.hexbench.core.display.HexLines;
import com.flashkit.hexbench.core.edit.EditBuffer;
import com.flashkit.hexbench.core.edit.EditEngine;
import com.flashkit.hexbench.core.edit.UndoAction;
import com.flashkit.hexbench.core.event.SessionEvent;
import com.flashkit.hexbench.core.event.SessionListener;
import com.flashkit.hexbench.core.export.AnalysisExporter;
import com.flashkit.hexbench.core.export.AnalysisReport;
import com.flashkit.hexbench.core.export.HexDumpExporter;
import com.flashkit.hexbench.core.inspect.DataInspector;
import com.flashkit.hexbench.core.io.BufferFiles;
import com.flashkit.hexbench.core.io.FileComparator;
import com.flashkit.hexbench.core.io.FileComparison;
import com.flashkit.hexbench.core.io.FilePicker;
import com.flashkit.hexbench.core.io.Json;
import com.flashkit.hexbench.core.io.LargeFileGate;
import com.flashkit.hexbench.core.io.RecentFiles;
import com.flashkit.hexbench.core.patch.HexPatch;
import com.flashkit.hexbench.core.result.EditorError;
import com.flashkit.hexbench.core.result.HexbenchException;
import com.flashkit.hexbench.core.result.Outcome;
import com.flashkit.hexbench.core.search.PatternMatcher;
import com.flashkit.hexbench.core.search.SearchResult;
import com.flashkit.hexbench.core.search.SearchResults;
import com.flashkit.hexbench.formats.api.Capped;
import com.flashkit.hexbench.formats.api.PatternHit;
import com.flashkit.hexbench.formats.api.StringMatch;
import com.flashkit.hexbench.formats.api.StructureNode;
import com.flashkit.hexbench.formats.registry.StructureDetector;
import com.flashkit.hexbench.types.DataKind;
import com.flashkit.hexbench.types.ErrorKind;
import com.flashkit.hexbench.util.FileSizes;
import com.flashkit.hexbench.util.HexText;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;

import java.nio.ByteOrder;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * One open binary file and everything the operator does to it.
 *
 * <p>The session owns the buffer, its undo history, the last search, the
 * bookmarks, the cursor and the selection. Loading and structure analysis
 * run on the worker executor and are awaited by the caller; every other
 * operation is synchronous. A session is confined to one thread at a time.
 *
 * <p>Results of loading and analysis are applied on the event executor, and
 * the listeners and status log see those events there. It defaults to the
 * worker executor; a caller with its own event loop passes that loop's
 * executor so every event arrives on one thread.
 *
 * <p>Offsets outside the buffer never throw: navigation clamps them, edits
 * ignore them, and both report what happened through the {@link StatusLog}
 * and a {@link SessionEvent.StatusMessage}.
 */
public class EditorSession {

    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final String NO_FILE = "No file loaded";

    private final EditorSettings settings;
    private final StatusLog statusLog;
    private final Executor executor;
    private final Executor eventExecutor;
    private final Clock clock;
    private final RecentFiles recentFiles;

    private final BufferFiles files;
    private final PatternMatcher matcher;
    private final StructureDetector detector;
    private final ChecksumEngine checksums = new ChecksumEngine();
    private final DataInspector inspector = new DataInspector();
    private final FileComparator comparator = new FileComparator();
    private final HexLines layout;
    private final BookmarkManager bookmarks;
    private final BookmarkStore bookmarkStore;
    private final HexDumpExporter dumpExporter;
    private final AnalysisExporter analysisExporter;

    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private Path path;
    private EditEngine engine;
    private SearchResults searchResults = SearchResults.empty();
    private long cursor;
    private long selectionStart;
    private int selectionLength;
    private ByteOrder byteOrder = ByteOrder.LITTLE_ENDIAN;
    private boolean dirty;

    private EditorSession(Builder builder) {
        this.settings = builder.settings;
        this.statusLog = builder.statusLog;
        this.executor = builder.executor;
        this.eventExecutor = builder.eventExecutor != null ? builder.eventExecutor : builder.executor;
        this.clock = builder.clock;
        this.recentFiles = builder.recentFiles;

        this.files = new BufferFiles(settings.confirmThresholdBytes());
        this.matcher = new PatternMatcher(settings.maxSearchResults());
        this.detector = new StructureDetector(settings.scanStride(), settings.minStringLength(),
                settings.maxSearchResults());
        this.layout = new HexLines(settings.bytesPerLine());
        this.bookmarks = new BookmarkManager(clock);
        this.bookmarkStore = new BookmarkStore(builder.objectMapper);
        this.dumpExporter = new HexDumpExporter(clock);
        this.analysisExporter = new AnalysisExporter(detector, checksums, builder.objectMapper, clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    // -- Listeners --

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    // -- Lifecycle --

    /**
     * Loads {@code file} on the worker executor and, on success, replaces the
     * current buffer. Unsaved changes in the current buffer are discarded;
     * check {@link SessionState#dirty()} first. A failed or declined load
     * leaves the current buffer in place.
     */
    public Uni<Outcome<EditBuffer>> open(Path file, LargeFileGate gate) {
        Objects.requireNonNull(file, "file cannot be null");
        Objects.requireNonNull(gate, "gate cannot be null");
        return Uni.createFrom().item(() -> files.load(file, gate))
                .runSubscriptionOn(executor)
                .emitOn(eventExecutor)
                .invoke(outcome -> {
                    if (outcome instanceof Outcome.Ok<EditBuffer> ok) {
                        install(file, ok.value());
                    } else {
                        outcome.failure().ifPresent(e -> status(e.message()));
                    }
                });
    }

    /**
     * Asks the picker for a file, then opens it. Cancelling the picker yields CANCELLED.
     */
    public Uni<Outcome<EditBuffer>> open(FilePicker picker, LargeFileGate gate) {
        Optional<Path> chosen = picker.chooseOpen("Open Binary File");
        if (chosen.isEmpty()) {
            return Uni.createFrom().item(Outcome.failed(ErrorKind.CANCELLED, "Open cancelled"));
        }
        return open(chosen.get(), gate);
    }

    /**
     * Drops the buffer and all state derived from it. Unsaved changes are discarded.
     */
    public void close() {
        if (engine == null) {
            return;
        }
        Path closed = path;
        reset();
        publish(new SessionEvent.BufferClosed(closed));
        status("Closed: " + closed);
    }

    public Outcome<Void> save() {
        if (engine == null) {
            return noFile();
        }
        return writeTo(path);
    }

    /**
     * Writes the buffer to {@code target}, which becomes the session's file.
     */
    public Outcome<Void> saveAs(Path target) {
        Objects.requireNonNull(target, "target cannot be null");
        if (engine == null) {
            return noFile();
        }
        Outcome<Void> result = writeTo(target);
        if (result.isOk()) {
            path = target;
            if (recentFiles != null) {
                recentFiles.add(target);
            }
        }
        return result;
    }

    public Outcome<Void> saveAs(FilePicker picker) {
        if (engine == null) {
            return noFile();
        }
        Optional<Path> chosen = picker.chooseSave("Save As", String.valueOf(path.getFileName()));
        if (chosen.isEmpty()) {
            return Outcome.failed(ErrorKind.CANCELLED, "Save cancelled");
        }
        return saveAs(chosen.get());
    }

    private Outcome<Void> writeTo(Path target) {
        Outcome<Void> result = files.save(engine.buffer(), target);
        if (result instanceof Outcome.Failed<Void> failed) {
            status(failed.error().message());
            return result;
        }
        syncDirty();
        status("Saved: " + target);
        return result;
    }

    private void install(Path file, EditBuffer buffer) {
        reset();
        path = file;
        engine = new EditEngine(buffer, settings.maxUndoHistory());
        if (recentFiles != null) {
            recentFiles.add(file);
        }
        publish(new SessionEvent.BufferLoaded(file, buffer.size()));
        status("Loaded: " + file.getFileName() + " (" + FileSizes.format(buffer.size()) + ")");
    }

    private void reset() {
        path = null;
        engine = null;
        searchResults = SearchResults.empty();
        bookmarks.clear();
        cursor = 0;
        selectionStart = 0;
        selectionLength = 0;
        dirty = false;
    }

    // -- Editing --

    /**
     * Overwrites one byte. Out-of-range offsets and unchanged values are ignored.
     *
     * @return true if the buffer changed
     */
    public boolean writeByte(long offset, byte value) {
        if (!checkEditable(offset)) {
            return false;
        }
        return applied(engine.writeByte(offset, value));
    }

    /**
     * Overwrites a range as one undoable action, clipped at the end of the buffer.
     */
    public boolean writeBytes(long offset, byte[] data) {
        if (!checkEditable(offset)) {
            return false;
        }
        if (offset + data.length > engine.buffer().size()) {
            status("Write clipped at end of file");
        }
        return applied(engine.writeBytes(offset, data));
    }

    public boolean fill(long offset, int length, byte value) {
        if (!checkEditable(offset)) {
            return false;
        }
        return applied(engine.fill(offset, length, value));
    }

    /**
     * Zero-fills a range. The buffer never shrinks.
     */
    public boolean clearRange(long offset, int length) {
        return fill(offset, length, (byte) 0);
    }

    public boolean fillSelection(byte value) {
        if (selectionLength == 0) {
            status("Nothing selected");
            return false;
        }
        return fill(selectionStart, selectionLength, value);
    }

    public boolean clearSelection() {
        return fillSelection((byte) 0);
    }

    /**
     * Writes hex text at the cursor. Odd-length or non-hex input is rejected
     * before the buffer is touched.
     *
     * @return number of bytes written
     */
    public Outcome<Integer> pasteHex(String hex) {
        if (engine == null) {
            return noFile();
        }
        byte[] bytes;
        try {
            bytes = HexText.parseCompact(hex);
        } catch (IllegalArgumentException e) {
            status("Invalid hex data: " + e.getMessage());
            return Outcome.failed(ErrorKind.INVALID_PATTERN, e.getMessage());
        }
        int written = (int) Math.min(bytes.length, engine.buffer().size() - cursor);
        writeBytes(cursor, bytes);
        status("Pasted " + written + " bytes at " + HexText.offset(cursor));
        return Outcome.ok(written);
    }

    /**
     * The selection as spaced hex, or an empty string when nothing is selected.
     */
    public String copyHex() {
        if (engine == null || selectionLength == 0) {
            return "";
        }
        return HexText.toSpacedHex(engine.buffer().data().copy(selectionStart, selectionLength));
    }

    /**
     * Applies a patch as one undoable action if the expected bytes are present.
     */
    public Outcome<Void> applyPatch(HexPatch patch) {
        if (engine == null) {
            return noFile();
        }
        byte[] replacement = patch.newBytes();
        if (!engine.buffer().data().contains(patch.offset(), replacement.length)) {
            return rejected(ErrorKind.OUT_OF_RANGE,
                    "Patch at " + HexText.offset(patch.offset()) + " runs past end of file");
        }
        if (!engine.buffer().data().matchesAt(patch.offset(), patch.originalBytes())) {
            return rejected(ErrorKind.INVALID_PATTERN,
                    "Original bytes don't match at offset " + HexText.offset(patch.offset()));
        }
        applied(engine.writeBytes(patch.offset(), replacement));
        status("Applied patch at " + HexText.offset(patch.offset()));
        return Outcome.done();
    }

    private boolean checkEditable(long offset) {
        if (engine == null) {
            status(NO_FILE);
            return false;
        }
        if (!engine.buffer().inRange(offset)) {
            status("Offset out of range: " + HexText.offset(offset));
            return false;
        }
        return true;
    }

    private boolean applied(Optional<UndoAction> action) {
        if (action.isEmpty()) {
            return false;
        }
        changed(action.get());
        return true;
    }

    /**
     * Publishes the redraw and dirty events for an applied or reverted action.
     */
    private void changed(UndoAction action) {
        long first = layout.lineOf(action.offset());
        long last = layout.lineOf(action.offset() + action.length() - 1);
        if (first == last) {
            publish(new SessionEvent.LineInvalidated(first));
        } else {
            publish(new SessionEvent.BufferChanged(action.offset(), action.length()));
        }
        syncDirty();
    }

    private void syncDirty() {
        boolean now = engine.buffer().isDirty();
        if (now != dirty) {
            dirty = now;
            publish(new SessionEvent.DirtyChanged(now));
        }
    }

    // -- Undo / redo --

    public boolean undo() {
        if (engine == null) {
            return false;
        }
        Optional<UndoAction> action = engine.undo();
        if (action.isEmpty()) {
            status("Nothing to undo");
            return false;
        }
        changed(action.get());
        moveCursor(action.get().offset());
        status("Undo at " + HexText.offset(action.get().offset()));
        return true;
    }

    public boolean redo() {
        if (engine == null) {
            return false;
        }
        Optional<UndoAction> action = engine.redo();
        if (action.isEmpty()) {
            status("Nothing to redo");
            return false;
        }
        changed(action.get());
        moveCursor(action.get().offset());
        status("Redo at " + HexText.offset(action.get().offset()));
        return true;
    }

    /**
     * Reverts every recorded action.
     *
     * @return number of actions undone
     */
    public int undoAll() {
        if (engine == null) {
            return 0;
        }
        int count = engine.undoAll();
        if (count > 0) {
            publish(new SessionEvent.BufferChanged(0, (int) engine.buffer().size()));
            syncDirty();
            status("Undid " + count + " changes");
        }
        return count;
    }

    // -- Search --

    /**
     * Searches for hex tokens or text, replacing the previous result set, and
     * selects the first hit.
     */
    public SearchResults search(String query) {
        if (engine == null) {
            status(NO_FILE);
            return SearchResults.empty();
        }
        searchResults = matcher.search(engine.buffer().data(), query);
        if (searchResults.isEmpty()) {
            status("Pattern not found");
        } else {
            status("Found " + searchResults.size() + " matches"
                    + (searchResults.truncated() ? " (showing first " + matcher.maxResults() + ")" : ""));
            findNext();
        }
        return searchResults;
    }

    public SearchResults searchResults() {
        return searchResults;
    }

    public Optional<SearchResult> findNext() {
        return selectHit(searchResults.next());
    }

    public Optional<SearchResult> findPrevious() {
        return selectHit(searchResults.previous());
    }

    private Optional<SearchResult> selectHit(Optional<SearchResult> hit) {
        hit.ifPresent(r -> {
            select(r.offset(), r.length());
            status("Match " + (searchResults.currentIndex() + 1) + " of " + searchResults.size()
                    + " at " + HexText.offset(r.offset()));
        });
        return hit;
    }

    /**
     * Replaces every hit of the last search that has the replacement's length,
     * then clears the results.
     *
     * @param replacementHex replacement bytes as hex; odd-length or malformed input is rejected
     * @return number of hits replaced
     */
    public Outcome<Integer> replaceAll(String replacementHex) {
        if (engine == null) {
            return noFile();
        }
        byte[] replacement;
        try {
            replacement = HexText.parseCompact(replacementHex);
        } catch (IllegalArgumentException e) {
            return rejected(ErrorKind.INVALID_PATTERN, "Invalid replacement: " + e.getMessage());
        }
        if (searchResults.isEmpty()) {
            status("No search results to replace");
            return Outcome.ok(0);
        }
        int length = replacement.length;
        int replaced = matcher.replaceAll(engine, searchResults, replacement);
        int skipped = (int) searchResults.results().stream().filter(r -> r.length() != length).count();
        searchResults = SearchResults.empty();
        if (replaced > 0) {
            publish(new SessionEvent.BufferChanged(0, (int) engine.buffer().size()));
            syncDirty();
        }
        status("Replaced " + replaced + " occurrences"
                + (skipped > 0 ? " (" + skipped + " skipped: length mismatch)" : ""));
        return Outcome.ok(replaced);
    }

    /**
     * Scans every offset for well-known magics. The hits become the current
     * result set, so find-next walks them.
     */
    public SearchResults findKnownPatterns() {
        if (engine == null) {
            status(NO_FILE);
            return SearchResults.empty();
        }
        Capped<PatternHit> hits = detector.findKnownPatterns(engine.buffer().data());
        searchResults = new SearchResults(null,
                hits.items().stream()
                        .map(h -> new SearchResult(h.offset(), h.length(), h.name()))
                        .toList(),
                hits.truncated());
        status("Found " + hits.size() + " known patterns");
        return searchResults;
    }

    public Capped<StringMatch> findStrings() {
        if (engine == null) {
            status(NO_FILE);
            return new Capped<>(List.of(), false);
        }
        Capped<StringMatch> strings = detector.extractStrings(engine.buffer().data());
        status("Found " + strings.size() + " strings"
                + (strings.truncated() ? " (showing first " + settings.maxSearchResults() + ")" : ""));
        return strings;
    }

    // -- Analysis --

    /**
     * Classifies the buffer and runs the signature scan on the worker executor.
     * The buffer must not be edited until the returned Uni completes.
     */
    public Uni<StructureNode> analyze() {
        if (engine == null) {
            return Uni.createFrom().failure(new HexbenchException(EditorError.of(ErrorKind.OUT_OF_RANGE, NO_FILE)));
        }
        EditBuffer buffer = engine.buffer();
        return Uni.createFrom().item(() -> detector.scanSignatures(buffer.data()))
                .runSubscriptionOn(executor)
                .emitOn(eventExecutor)
                .invoke(root -> status("Structure analysis complete: "
                        + root.children().size() + " regions in " + root.name()));
    }

    /**
     * Fresh checksums of the buffer as it is now.
     */
    public Outcome<ChecksumReport> checksum() {
        if (engine == null) {
            return noFile();
        }
        return Outcome.ok(checksums.compute(engine.buffer().data()));
    }

    public Outcome<FileComparison> compareWith(Path other) {
        if (engine == null) {
            return noFile();
        }
        Outcome<FileComparison> result = comparator.compare(engine.buffer().data(), other);
        if (result instanceof Outcome.Ok<FileComparison> ok) {
            FileComparison comparison = ok.value();
            if (comparison.identical()) {
                status("Files are identical");
            } else {
                status("Found " + comparison.differences().size() + " differences"
                        + (comparison.sameSize() ? "" : "; sizes differ ("
                        + comparison.leftSize() + " vs " + comparison.rightSize() + ")"));
                if (!comparison.differences().isEmpty()) {
                    moveCursor(comparison.differences().get(0));
                }
            }
        } else {
            result.failure().ifPresent(e -> status(e.message()));
        }
        return result;
    }

    // -- Inspector --

    public String inspect(DataKind kind) {
        if (engine == null) {
            return DataInspector.UNAVAILABLE;
        }
        return inspector.decode(engine.buffer().data(), cursor, kind, byteOrder);
    }

    public Map<DataKind, String> inspectAll() {
        if (engine == null) {
            return Map.of();
        }
        return inspector.decodeAll(engine.buffer().data(), cursor, byteOrder);
    }

    public void byteOrder(ByteOrder order) {
        this.byteOrder = Objects.requireNonNull(order, "order cannot be null");
    }

    public ByteOrder byteOrder() {
        return byteOrder;
    }

    // -- Navigation --

    /**
     * Moves the cursor to an offset typed by the operator ({@code 0x1F0} or {@code 496}).
     * Offsets past the end are clamped to the last byte.
     *
     * @return the offset actually moved to
     */
    public Outcome<Long> goTo(String text) {
        if (engine == null) {
            return noFile();
        }
        OptionalLong parsed = HexText.parseOffset(text);
        if (parsed.isEmpty()) {
            return rejected(ErrorKind.INVALID_PATTERN, "Invalid offset: " + text);
        }
        long target = clampOffset(parsed.getAsLong());
        if (target != parsed.getAsLong()) {
            status("Offset " + text.trim() + " out of range, moved to " + HexText.offset(target));
        }
        select(target, 0);
        return Outcome.ok(target);
    }

    /**
     * Selects [start, start+length), clamped to the buffer, and moves the cursor to start.
     */
    public void select(long start, long length) {
        if (engine == null) {
            return;
        }
        long size = engine.buffer().size();
        long clampedStart = Math.max(0, Math.min(start, size));
        long clampedLength = Math.max(0, Math.min(length, size - clampedStart));
        if (clampedStart != start || clampedLength != length) {
            status("Selection clamped to " + HexText.offset(clampedStart) + " +" + clampedLength);
        }
        selectionStart = clampedStart;
        selectionLength = (int) clampedLength;
        publish(new SessionEvent.SelectionChanged(selectionStart, selectionLength));
        moveCursor(clampOffset(clampedStart));
    }

    public void moveCursor(long offset) {
        if (engine == null) {
            return;
        }
        long clamped = clampOffset(offset);
        if (clamped != cursor) {
            cursor = clamped;
            publish(new SessionEvent.CursorMoved(cursor));
        }
    }

    public long cursor() {
        return cursor;
    }

    private long clampOffset(long offset) {
        long last = Math.max(0, engine.buffer().size() - 1);
        return Math.max(0, Math.min(offset, last));
    }

    /**
     * Display rows {@code first .. first+count-1} with modified bytes flagged.
     */
    public List<HexLine> lines(long first, int count) {
        if (engine == null) {
            return List.of();
        }
        return layout.lines(engine.buffer(), first, count);
    }

    public long lineCount() {
        return engine == null ? 0 : layout.lineCount(engine.buffer().size());
    }

    // -- Bookmarks --

    public BookmarkManager bookmarks() {
        return bookmarks;
    }

    /**
     * Bookmarks the cursor position.
     */
    public Optional<Bookmark> addBookmark(String name) {
        if (engine == null) {
            status(NO_FILE);
            return Optional.empty();
        }
        Bookmark bookmark = bookmarks.add(name, cursor,
                "Added at " + LocalTime.now(clock).format(TIME_OF_DAY));
        status("Bookmark '" + name + "' at " + HexText.offset(cursor));
        return Optional.of(bookmark);
    }

    public Optional<Bookmark> nextBookmark() {
        return jumpTo(bookmarks.next(cursor));
    }

    public Optional<Bookmark> previousBookmark() {
        return jumpTo(bookmarks.previous(cursor));
    }

    private Optional<Bookmark> jumpTo(Optional<Bookmark> bookmark) {
        if (bookmark.isEmpty()) {
            status("No more bookmarks");
        }
        bookmark.ifPresent(b -> select(b.offset(), 0));
        return bookmark;
    }

    public Outcome<Void> exportBookmarks(Path target) {
        return bookmarkStore.write(target, bookmarks.list());
    }

    /**
     * Appends bookmarks from a JSON file written by {@link #exportBookmarks(Path)}.
     *
     * @return number of bookmarks added
     */
    public Outcome<Integer> importBookmarks(Path source) {
        return bookmarkStore.read(source).map(list -> {
            bookmarks.addAll(list);
            status("Imported " + list.size() + " bookmarks");
            return list.size();
        });
    }

    // -- Export --

    public Outcome<Void> exportSelection(Path target) {
        if (engine == null) {
            return noFile();
        }
        if (selectionLength == 0) {
            return rejected(ErrorKind.OUT_OF_RANGE, "Nothing selected");
        }
        Outcome<Void> result = files.saveRange(engine.buffer(), selectionStart, selectionLength, target);
        reportExport(result, "Exported " + selectionLength + " bytes to " + target);
        return result;
    }

    public Outcome<Void> exportHexDump(Path target) {
        if (engine == null) {
            return noFile();
        }
        Outcome<Void> result = dumpExporter.export(engine.buffer().data(), String.valueOf(path), target);
        reportExport(result, "Hex dump exported to " + target);
        return result;
    }

    public Outcome<AnalysisReport> analysisReport() {
        if (engine == null) {
            return noFile();
        }
        return Outcome.ok(analysisExporter.analyze(engine.buffer().data(), String.valueOf(path)));
    }

    public Outcome<Void> exportAnalysis(Path target) {
        if (engine == null) {
            return noFile();
        }
        Outcome<Void> result = analysisExporter.exportText(analysisReport().orElseThrow(), target);
        reportExport(result, "Analysis exported to " + target);
        return result;
    }

    public Outcome<Void> exportAnalysisJson(Path target) {
        if (engine == null) {
            return noFile();
        }
        Outcome<Void> result = analysisExporter.exportJson(analysisReport().orElseThrow(), target);
        reportExport(result, "Analysis exported to " + target);
        return result;
    }

    private void reportExport(Outcome<Void> result, String success) {
        status(result.failure().map(EditorError::message).orElse(success));
    }

    // -- State --

    public Optional<EditBuffer> buffer() {
        return engine == null ? Optional.empty() : Optional.of(engine.buffer());
    }

    public Optional<RecentFiles> recentFiles() {
        return Optional.ofNullable(recentFiles);
    }

    public EditorSettings settings() {
        return settings;
    }

    public SessionState state() {
        if (engine == null) {
            return new SessionState(null, 0, false, 0, 0, 0, 0, 0, 0, 0, bookmarks.size(), byteOrder);
        }
        EditBuffer buffer = engine.buffer();
        return new SessionState(path, buffer.size(), buffer.isDirty(), buffer.modifiedOffsets().size(),
                cursor, selectionStart, selectionLength,
                engine.history().undoDepth(), engine.history().redoDepth(),
                searchResults.size(), bookmarks.size(), byteOrder);
    }

    private void status(String message) {
        statusLog.status(message);
        publish(new SessionEvent.StatusMessage(message));
    }

    private void publish(SessionEvent event) {
        for (SessionListener listener : listeners) {
            listener.onEvent(event);
        }
    }

    private <T> Outcome<T> noFile() {
        return Outcome.failed(ErrorKind.OUT_OF_RANGE, NO_FILE);
    }

    private <T> Outcome<T> rejected(ErrorKind kind, String message) {
        status(message);
        return Outcome.failed(kind, message);
    }

    /**
     * Collaborators and settings for a session. Everything has a default.
     */
    public static class Builder {

        private EditorSettings settings = EditorSettings.defaults();
        private StatusLog statusLog = StatusLog.jboss(EditorSession.class);
        private Executor executor = Infrastructure.getDefaultWorkerPool();
        private Executor eventExecutor;
        private Clock clock = Clock.systemDefaultZone();
        private ObjectMapper objectMapper = Json.mapper();
        private RecentFiles recentFiles;

        private Builder() {
        }

        public Builder settings(EditorSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings cannot be null");
            return this;
        }

        public Builder statusLog(StatusLog statusLog) {
            this.statusLog = Objects.requireNonNull(statusLog, "statusLog cannot be null");
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor cannot be null");
            return this;
        }

        /**
         * Where load and analysis results are applied and their events published.
         * Unset means the worker executor.
         */
        public Builder eventExecutor(Executor eventExecutor) {
            this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
            return this;
        }

        public Builder recentFiles(RecentFiles recentFiles) {
            this.recentFiles = recentFiles;
            return this;
        }

        public EditorSession build() {
            return new EditorSession(this);
        }
    }
}

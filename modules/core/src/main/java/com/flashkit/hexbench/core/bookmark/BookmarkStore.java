package com.flashkit.hexbench.core.bookmark;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flashkit.hexbench.core.result.EditorError;
import com.flashkit.hexbench.core.result.Outcome;
import com.flashkit.hexbench.types.ErrorKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes bookmark lists as a JSON array.
 */
public class BookmarkStore {

    private static final TypeReference<List<Bookmark>> BOOKMARK_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public BookmarkStore(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public Outcome<Void> write(Path path, List<Bookmark> bookmarks) {
        try {
            Files.write(path, objectMapper.writeValueAsBytes(bookmarks));
            return Outcome.done();
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo("writing bookmarks to", path, e));
        }
    }

    public Outcome<List<Bookmark>> read(Path path) {
        try {
            List<Bookmark> bookmarks = objectMapper.readValue(Files.readAllBytes(path), BOOKMARK_LIST);
            return Outcome.ok(bookmarks != null ? List.copyOf(bookmarks) : List.of());
        } catch (JsonProcessingException e) {
            return Outcome.failed(ErrorKind.DECODE_FAILURE,
                    "Invalid bookmark file " + path + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            return Outcome.failed(EditorError.fromIo("reading bookmarks from", path, e));
        }
    }
}

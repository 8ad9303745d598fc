package com.flashkit.hexbench.core.search;

import com.flashkit.hexbench.util.HexText;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed search query: the exact bytes to look for and how they were read.
 *
 * <p>Text containing a space and nothing but hex digits and spaces is read as
 * hex tokens ({@code "FF 00 AB"}). Anything else, including hex that fails to
 * parse, is searched for as UTF-8 text.
 */
public record SearchQuery(String text, byte[] pattern, boolean hex) {

    public SearchQuery {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(pattern, "pattern cannot be null");
        pattern = Arrays.copyOf(pattern, pattern.length);
    }

    public static SearchQuery parse(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        if (looksLikeHex(text)) {
            Optional<byte[]> bytes = HexText.parseTokens(text);
            if (bytes.isPresent()) {
                return new SearchQuery(text, bytes.get(), true);
            }
        }
        return new SearchQuery(text, encodeText(text), false);
    }

    private static boolean looksLikeHex(String text) {
        if (text.indexOf(' ') < 0) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != ' ' && Character.digit(c, 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static byte[] encodeText(String text) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            // Lone surrogates and the like
            return text.getBytes(StandardCharsets.US_ASCII);
        }
    }

    @Override
    public byte[] pattern() {
        return Arrays.copyOf(pattern, pattern.length);
    }

    public int length() {
        return pattern.length;
    }

    public boolean isEmpty() {
        return pattern.length == 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SearchQuery other)) return false;
        return hex == other.hex && text.equals(other.text) && Arrays.equals(pattern, other.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, hex) * 31 + Arrays.hashCode(pattern);
    }

    @Override
    public String toString() {
        return "SearchQuery[" + (hex ? "hex " : "text ") + '"' + text + "\"]";
    }
}

package com.flashkit.hexbench.util;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Conversions between bytes and the hex text operators type and read.
 *
 * <p>Two input styles are accepted:
 * <ul>
 *   <li>token form {@code "FF 00 AB"}: whitespace-separated tokens of one or two digits</li>
 *   <li>compact form {@code "FF00AB"} or {@code "FF-00-AB"}: an even number of digits</li>
 * </ul>
 * Output is always upper case.
 */
public final class HexText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN = Pattern.compile("[0-9A-Fa-f]{1,2}");

    private HexText() {
    }

    /**
     * Parses whitespace-separated hex tokens, one byte per token.
     *
     * @return the bytes, or empty if any token is not a valid byte
     */
    public static Optional<byte[]> parseTokens(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        String[] tokens = WHITESPACE.split(trimmed);
        byte[] bytes = new byte[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            if (!TOKEN.matcher(tokens[i]).matches()) {
                return Optional.empty();
            }
            bytes[i] = (byte) Integer.parseInt(tokens[i], 16);
        }
        return Optional.of(bytes);
    }

    /**
     * Parses compact hex, ignoring spaces and dashes.
     *
     * @throws IllegalArgumentException on odd length or non-hex characters
     */
    public static byte[] parseCompact(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        String digits = text.replace(" ", "").replace("-", "");
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("Empty hex string");
        }
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("Odd-length hex string: " + digits.length() + " digits");
        }
        try {
            return Hex.decodeHex(digits);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string: " + text, e);
        }
    }

    /**
     * Upper-case hex without separators ({@code "CAFEBABE"}).
     */
    public static String toHex(byte[] bytes) {
        return Hex.encodeHexString(bytes, false);
    }

    /**
     * Upper-case hex with one space between bytes ({@code "CA FE BA BE"}).
     */
    public static String toSpacedHex(byte[] bytes) {
        if (bytes.length == 0) {
            return "";
        }
        char[] digits = Hex.encodeHex(bytes, false);
        StringBuilder sb = new StringBuilder(bytes.length * 3 - 1);
        for (int i = 0; i < digits.length; i += 2) {
            if (i > 0) sb.append(' ');
            sb.append(digits[i]).append(digits[i + 1]);
        }
        return sb.toString();
    }

    /**
     * Two upper-case digits for one byte.
     */
    public static String toHex(byte b) {
        return toHex(new byte[]{b});
    }

    /**
     * Formats an offset as {@code 0x} plus eight upper-case digits.
     */
    public static String offset(long offset) {
        return String.format("0x%08X", offset);
    }

    /**
     * Parses an offset typed by an operator: {@code 0x}-prefixed hex or plain decimal.
     *
     * @return the offset, or empty if the text is neither
     */
    public static OptionalLong parseOffset(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        String input = text.trim();
        if (input.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            if (input.regionMatches(true, 0, "0x", 0, 2)) {
                return OptionalLong.of(Long.parseLong(input.substring(2), 16));
            }
            return OptionalLong.of(Long.parseLong(input));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}

package com.delta.feedscout.feed.text;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw feed entry titles into display strings.
 *
 * <p>The pass is five stages applied in a fixed order: markup strip, encoding
 * repair, residual artifact substitution, character allow-list, whitespace
 * collapse. Each stage is exposed on its own so it can be exercised in
 * isolation. {@link #normalize(String)} repeats the pass until the text stops
 * changing, so its output is always a fixed point.
 */
public final class TitleNormalizer {
    private static final Pattern MARKUP_TAG = Pattern.compile("<[^>]+>");

    // Word characters, whitespace, '&', the right curly quotes and everything
    // from the apostrophe up to the left double quote. The range keeps the
    // hyphen, ASCII punctuation, Latin-1 letters and the en/em dashes.
    private static final Pattern DISALLOWED_CHARACTER = Pattern.compile(
        "[^\\w\\s'-\\u201C\\u201D\\u2019&]",
        Pattern.UNICODE_CHARACTER_CLASS
    );
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Map<String, String> ARTIFACT_REPLACEMENTS = new LinkedHashMap<>();

    static {
        // UTF-8 punctuation read as ISO-8859-1
        ARTIFACT_REPLACEMENTS.put("\u00e2\u0080\u0099", "\u2019");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u0080\u009c", "\u201c");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u0080\u009d", "\u201d");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u0080\u0093", "\u2013");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u0080\u0094", "\u2014");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u0080\u00a6", "\u2026");
        // the same bytes read as windows-1252
        ARTIFACT_REPLACEMENTS.put("\u00e2\u20ac\u2122", "\u2019");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u20ac\u0153", "\u201c");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u20ac\u009d", "\u201d");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u20ac\u201c", "\u2013");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u20ac\u201d", "\u2014");
        ARTIFACT_REPLACEMENTS.put("\u00e2\u20ac\u00a6", "\u2026");
    }

    private TitleNormalizer() {
    }

    public static String normalize(String raw) {
        String current = raw == null ? "" : raw;
        while (true) {
            String next = cleanOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    static String cleanOnce(String text) {
        String result = stripMarkup(text);
        result = repairEncoding(result);
        result = replaceKnownArtifacts(result);
        result = removeDisallowedCharacters(result);
        return collapseWhitespace(result);
    }

    public static String stripMarkup(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return MARKUP_TAG.matcher(text).replaceAll("");
    }

    /**
     * Reverses UTF-8 text that was decoded as ISO-8859-1. Returns the input
     * unchanged when it holds characters outside that charset or when its bytes
     * are not valid UTF-8.
     */
    public static String repairEncoding(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        byte[] bytes = new byte[text.length()];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c > 0xFF) {
                return text;
            }
            bytes[i] = (byte) c;
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            return text;
        }
    }

    public static String replaceKnownArtifacts(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = text;
        for (Map.Entry<String, String> entry : ARTIFACT_REPLACEMENTS.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }

    public static String removeDisallowedCharacters(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return DISALLOWED_CHARACTER.matcher(text).replaceAll("");
    }

    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").strip();
    }
}

package com.playlistchecker.common.util;

import java.util.regex.Pattern;

/**
 * Macht aus Anzeigenamen sichere Bezeichner (Dateinamen, Map-Keys).
 */
public final class NameNormalizer {

    private static final String NBSP_ENTITY = "&nbsp;";
    private static final char NBSP = '\u00A0';

    // Underscore bleibt erhalten, sonst wäre normalize() nicht idempotent
    private static final Pattern UNWANTED = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private NameNormalizer() {
    }

    /**
     * Replaces non-breaking spaces (glyph or {@code &nbsp;} entity) with spaces, drops every
     * character that is neither a word character nor whitespace, trims, and joins the remaining
     * words with single underscores.
     *
     * @return the normalized name; empty if nothing usable is left
     */
    public static String normalize(String rawName) {
        if (rawName == null || rawName.isEmpty()) return "";

        String cleaned = rawName.replace(NBSP_ENTITY, " ").replace(NBSP, ' ');
        cleaned = UNWANTED.matcher(cleaned).replaceAll("");
        cleaned = cleaned.strip();
        if (cleaned.isEmpty()) return "";
        return WHITESPACE.matcher(cleaned).replaceAll("_");
    }
}

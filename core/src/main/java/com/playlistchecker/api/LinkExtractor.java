package com.playlistchecker.api;

import java.util.Map;

/**
 * Strategie zum Auslesen der Playlist-Links aus dem Index-Dokument.
 * <p>
 * Records are visited in document order; the name is normalized and a later record with the same
 * normalized name replaces the URL of an earlier one. Records whose name normalizes to an empty
 * string are skipped. No match yields an empty map, never an exception.
 */
public interface LinkExtractor {
    Map<String, String> extract(String documentText);
}

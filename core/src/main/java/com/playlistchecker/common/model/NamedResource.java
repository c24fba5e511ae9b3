package com.playlistchecker.common.model;

/**
 * Ein Playlist-Verweis aus dem Index-Dokument.
 * Name ist bereits normalisiert (siehe NameNormalizer).
 */
public record NamedResource(
        String name,
        String url
) {
    public NamedResource {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("name must not be empty");
        if (url == null || url.isEmpty()) throw new IllegalArgumentException("url must not be empty");
    }
}

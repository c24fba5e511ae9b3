package com.playlistchecker.common.model;

/**
 * One playable item of a playlist: the metadata line (may be empty) and the URL line after it.
 */
public record PlaylistEntry(
        String metadata,
        String url
) {
    public PlaylistEntry {
        if (url == null || url.isEmpty()) throw new IllegalArgumentException("url must not be empty");
        if (metadata == null) metadata = "";
    }

    /**
     * Output form: {@code <metadata-line>\n<url-line>}.
     */
    public String toM3u() {
        return metadata + "\n" + url;
    }
}

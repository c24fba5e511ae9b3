package com.playlistchecker.modules.playlist;

import com.playlistchecker.common.model.PlaylistEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass line parser for (extended) M3U text.
 * <p>
 * A metadata line is kept as pending until the next URL line, which emits one entry and clears
 * it. A second metadata line replaces an unpaired one. Anything else (blank lines, {@code #EXTM3U},
 * other directives) is ignored, and metadata still pending at the end is dropped.
 */
public class M3uParser {
    public static final String DEFAULT_METADATA_MARKER = "#EXTINF";
    public static final String DEFAULT_URL_PREFIX = "http";

    private final String metadataMarker;
    private final String urlPrefix;

    public M3uParser() {
        this(DEFAULT_METADATA_MARKER, DEFAULT_URL_PREFIX);
    }

    public M3uParser(String metadataMarker, String urlPrefix) {
        this.metadataMarker = metadataMarker;
        this.urlPrefix = urlPrefix;
    }

    public List<PlaylistEntry> parse(String playlistText) {
        List<PlaylistEntry> entries = new ArrayList<>();
        if (playlistText == null || playlistText.isEmpty()) return entries;

        String pendingMetadata = "";
        for (String raw : playlistText.lines().toList()) {
            String line = raw.strip();
            if (line.startsWith(metadataMarker)) {
                pendingMetadata = line;
            } else if (line.startsWith(urlPrefix)) {
                entries.add(new PlaylistEntry(pendingMetadata, line));
                pendingMetadata = "";
            }
        }
        return entries;
    }
}

package com.playlistchecker.core.config;

public class Configuration {
    public static final String DEFAULT_PATTERN = "<td>(.+?)</td>.*?<code>(https://[^\\s]+\\.m3u(?:8)?)</code>";

    // --- Quelle ---
    public String indexUrl = "https://raw.githubusercontent.com/iptv-org/iptv/master/README.md";

    // --- Ausgabe ---
    public String playlistDir = "m3u_files";
    public String processedDir = "processed";

    // --- Netzwerk (Millisekunden) ---
    public int fetchTimeoutMs = 10_000;
    public int probeTimeoutMs = 5_000;
    public String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) PlaylistChecker/1.0";

    // --- Worker ---
    // Anzahl Playlists, die gleichzeitig geprüft werden
    public int workerCount = 5;
    // Gleichzeitige Probes innerhalb einer Playlist
    public int probeParallelism = 1;

    // --- Parsing ---
    // "regex" oder "html"
    public String extractor = "regex";
    public String extractorPattern = DEFAULT_PATTERN;
    public String metadataMarker = "#EXTINF";
    public String urlPrefix = "http";

    public boolean debugMode = false;
}

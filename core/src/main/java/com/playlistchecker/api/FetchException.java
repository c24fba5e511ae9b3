package com.playlistchecker.api;

/**
 * Fehler beim Abrufen einer Ressource (Transport oder Nicht-2xx-Status).
 */
public class FetchException extends Exception {
    private final String url;
    private final int status;

    public FetchException(String url, Throwable cause) {
        super("Fetch failed for " + url + ": " + (cause != null ? cause.toString() : "unknown"), cause);
        this.url = url;
        this.status = -1;
    }

    public FetchException(String url, int status) {
        super("Fetch failed for " + url + ": HTTP " + status);
        this.url = url;
        this.status = status;
    }

    public String getUrl() {
        return url;
    }

    /**
     * HTTP status of the failed response, or -1 if no response was received.
     */
    public int getStatus() {
        return status;
    }
}

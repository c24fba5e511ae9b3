package com.playlistchecker.api;

/**
 * Retrieves the text body of a URL. Used for the index document and every playlist.
 * One blocking attempt per call, no retries.
 */
public interface ResourceFetcher {
    /**
     * @param url       absolute http(s) URL
     * @param timeoutMs connect and read timeout
     * @return the body decoded as UTF-8
     * @throws FetchException on transport failure or a non-2xx status
     */
    String fetchText(String url, int timeoutMs) throws FetchException;
}

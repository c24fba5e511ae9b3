package com.playlistchecker.services.http;

import com.playlistchecker.api.FetchException;
import com.playlistchecker.api.ResourceFetcher;
import com.playlistchecker.common.util.HttpUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.HttpURLConnection;

/**
 * GET via {@link HttpURLConnection}. Redirects are followed by hand (also http -> https),
 * nothing is retried.
 */
public class HttpResourceFetcher implements ResourceFetcher {
    private static final Logger logger = LoggerFactory.getLogger(HttpResourceFetcher.class);

    static final int MAX_REDIRECTS = 5;

    private final String userAgent;

    public HttpResourceFetcher(String userAgent) {
        this.userAgent = userAgent;
    }

    @Override
    public String fetchText(String url, int timeoutMs) throws FetchException {
        String current = url;
        for (int hop = 0; ; hop++) {
            HttpURLConnection conn = null;
            try {
                conn = HttpUtils.open(current, "GET", timeoutMs, userAgent);
                // HttpURLConnection bleibt beim Protokoll, daher selbst umleiten
                conn.setInstanceFollowRedirects(false);
                int status = conn.getResponseCode();

                if (HttpUtils.isRedirect(status)) {
                    String location = conn.getHeaderField("Location");
                    HttpUtils.discardErrorBody(conn);
                    if (location == null || location.isBlank() || hop >= MAX_REDIRECTS) {
                        throw new FetchException(current, status);
                    }
                    String next = HttpUtils.resolveLocation(current, location);
                    logger.debug("GET {} -> {} redirect to {}", current, status, next);
                    current = next;
                    continue;
                }

                if (!HttpUtils.isSuccess(status)) {
                    HttpUtils.discardErrorBody(conn);
                    throw new FetchException(current, status);
                }
                String body = HttpUtils.readBody(conn);
                logger.debug("GET {} -> {} ({} chars)", current, status, body.length());
                return body;
            } catch (IOException | RuntimeException e) {
                throw new FetchException(current, e);
            } finally {
                if (conn != null) conn.disconnect();
            }
        }
    }
}

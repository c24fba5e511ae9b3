package com.playlistchecker.services.http;

import com.playlistchecker.api.LivenessProber;
import com.playlistchecker.common.model.ProbeResult;
import com.playlistchecker.common.util.HttpUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.HttpURLConnection;

/**
 * HEAD-Request gegen eine Stream-URL. Kein Body, keine Exceptions nach außen.
 */
public class HttpLivenessProber implements LivenessProber {
    private static final Logger logger = LoggerFactory.getLogger(HttpLivenessProber.class);

    private final String userAgent;

    public HttpLivenessProber(String userAgent) {
        this.userAgent = userAgent;
    }

    @Override
    public ProbeResult probe(String url, int timeoutMs) {
        HttpURLConnection conn = null;
        try {
            conn = HttpUtils.open(url, "HEAD", timeoutMs, userAgent);
            int status = conn.getResponseCode();
            if (status < 0) {
                logger.warn("No valid HTTP response from {}", url);
                return ProbeResult.PROBE_FAILED;
            }
            if (HttpUtils.isSuccess(status)) {
                logger.info("URL is available: {}", url);
                return ProbeResult.REACHABLE;
            }
            logger.warn("URL is unavailable (status code {}): {}", status, url);
            return ProbeResult.UNREACHABLE;
        } catch (IOException | RuntimeException e) {
            logger.warn("Error checking URL {}: {}", url, e.toString());
            return ProbeResult.PROBE_FAILED;
        } finally {
            if (conn != null) conn.disconnect();
        }
    }
}

package com.playlistchecker.common.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

/**
 * Low-level helpers around {@link HttpURLConnection} shared by the fetcher and the prober.
 */
public final class HttpUtils {
    private static final Logger logger = LoggerFactory.getLogger(HttpUtils.class);
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) PlaylistChecker/1.0";

    private HttpUtils() {
    }

    /**
     * Opens a connection with both connect and read timeout set to {@code timeoutMs}.
     * The request is not sent until the caller asks for the response.
     */
    public static HttpURLConnection open(String urlStr, String method, int timeoutMs, String userAgent) throws IOException {
        URL url = new URL(urlStr);
        if (!"http".equalsIgnoreCase(url.getProtocol()) && !"https".equalsIgnoreCase(url.getProtocol())) {
            throw new IOException("Unsupported protocol: " + url.getProtocol());
        }
        url = quoteIllegalCharacters(url);

        HttpURLConnection conn = (HttpURLConnection) url.openConnection();
        conn.setRequestMethod(method);
        conn.setConnectTimeout(timeoutMs);
        conn.setReadTimeout(timeoutMs);
        conn.setInstanceFollowRedirects(true);
        conn.setRequestProperty("User-Agent", userAgent != null ? userAgent : DEFAULT_USER_AGENT);
        conn.setRequestProperty("Accept-Encoding", "gzip");
        return conn;
    }

    /**
     * Percent-encodes characters that are not allowed in a request line (spaces, {@code |}, ...).
     * Existing escapes stay as they are.
     */
    static URL quoteIllegalCharacters(URL url) throws IOException {
        try {
            return new URI(url.getProtocol(), url.getUserInfo(), url.getHost(), url.getPort(),
                    url.getPath(), url.getQuery(), url.getRef()).toURL();
        } catch (URISyntaxException e) {
            throw new IOException("Malformed URL: " + url, e);
        }
    }

    /**
     * Resolves a {@code Location} header against the URL that answered with it.
     */
    public static String resolveLocation(String baseUrl, String location) throws IOException {
        return new URL(new URL(baseUrl), location).toString();
    }

    public static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    /**
     * Reads the whole response body as UTF-8, unwrapping gzip if the server used it.
     */
    public static String readBody(HttpURLConnection conn) throws IOException {
        InputStream in = conn.getInputStream();
        if ("gzip".equalsIgnoreCase(conn.getContentEncoding())) {
            in = new GZIPInputStream(in);
        }

        try (InputStream body = in; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            byte[] buffer = new byte[8192];
            int count;
            while ((count = body.read(buffer)) != -1) {
                out.write(buffer, 0, count);
            }
            return out.toString(StandardCharsets.UTF_8);
        }
    }

    /**
     * Drains and closes the error stream so the keep-alive connection can be reused.
     */
    public static void discardErrorBody(HttpURLConnection conn) {
        try (InputStream err = conn.getErrorStream()) {
            if (err != null) err.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            logger.debug("Could not drain error body of {}: {}", conn.getURL(), e.getMessage());
        }
    }
}

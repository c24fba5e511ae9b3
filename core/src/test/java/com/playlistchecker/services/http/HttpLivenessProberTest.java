package com.playlistchecker.services.http;

import com.playlistchecker.common.model.ProbeResult;
import com.playlistchecker.test.LocalHttpServer;
import com.playlistchecker.test.TestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

class HttpLivenessProberTest extends TestBase {

    private LocalHttpServer server;
    private final HttpLivenessProber prober = new HttpLivenessProber("PlaylistCheckerTest/1.0");

    @BeforeEach
    void startServer() throws IOException {
        server = new LocalHttpServer()
                .respond("/live", 200, "stream")
                .respond("/gone", 404, "missing")
                .respond("/broken", 503, "")
                .respondSlowly("/slow", 3_000);
    }

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void testSuccessIsReachable() {
        assertEquals(ProbeResult.REACHABLE, prober.probe(server.url("/live"), 2_000));
    }

    @Test
    void testUnencodedCharactersAreSentEncoded() {
        assertEquals(ProbeResult.REACHABLE, prober.probe(server.url("/live/channel one|hd.m3u8"), 2_000));
    }

    @Test
    void testErrorStatusIsUnreachable() {
        assertEquals(ProbeResult.UNREACHABLE, prober.probe(server.url("/gone"), 2_000));
        assertEquals(ProbeResult.UNREACHABLE, prober.probe(server.url("/broken"), 2_000));
    }

    @Test
    void testTimeoutIsProbeFailed() {
        long start = System.currentTimeMillis();
        assertEquals(ProbeResult.PROBE_FAILED, prober.probe(server.url("/slow"), 300));
        assertTrue(System.currentTimeMillis() - start < 2_500, "Probe must give up at its timeout");
    }

    @Test
    void testConnectionRefusedIsProbeFailed() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        assertEquals(ProbeResult.PROBE_FAILED, prober.probe("http://127.0.0.1:" + port + "/x", 1_000));
    }

    @Test
    void testMalformedUrlIsProbeFailed() {
        assertEquals(ProbeResult.PROBE_FAILED, prober.probe("http://bad host/with spaces", 1_000));
        assertEquals(ProbeResult.PROBE_FAILED, prober.probe("ftp://files.test/x.ts", 1_000));
    }

    @Test
    void testUnavailablePartitionGroupsBothFailureKinds() {
        assertFalse(prober.probe(server.url("/gone"), 2_000).isAvailable());
        assertFalse(prober.probe(server.url("/slow"), 300).isAvailable());
    }
}

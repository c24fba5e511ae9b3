package com.playlistchecker.core.config;

import com.playlistchecker.test.TestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigManager
 */
class ConfigManagerTest extends TestBase {

    @TempDir
    Path tempDir;

    @Test
    void testMissingFileWritesDefaults() {
        Path file = tempDir.resolve("config.json");
        ConfigManager manager = new ConfigManager(file, key -> null);

        assertTrue(Files.exists(file), "Default config should be written");
        Configuration config = manager.getConfig();
        assertEquals(5, config.workerCount);
        assertEquals(10_000, config.fetchTimeoutMs);
        assertEquals(5_000, config.probeTimeoutMs);
        assertEquals("m3u_files", config.playlistDir);
        assertEquals("processed", config.processedDir);
        assertEquals(Configuration.DEFAULT_PATTERN, config.extractorPattern);
    }

    @Test
    void testLoadsValuesFromFile() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{ \"indexUrl\": \"http://localhost/readme.md\", \"workerCount\": 2, \"extractor\": \"html\" }",
                StandardCharsets.UTF_8);

        Configuration config = new ConfigManager(file, key -> null).getConfig();

        assertEquals("http://localhost/readme.md", config.indexUrl);
        assertEquals(2, config.workerCount);
        assertEquals("html", config.extractor);
        assertEquals(5_000, config.probeTimeoutMs, "Fields missing from the file keep their defaults");
    }

    @Test
    void testOverridesWinOverFile() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{ \"workerCount\": 2, \"processedDir\": \"out\" }", StandardCharsets.UTF_8);
        Map<String, String> env = Map.of(
                "PLAYLIST_WORKER_COUNT", "8",
                "PLAYLIST_PROBE_TIMEOUT_MS", "1500",
                "PLAYLIST_INDEX_URL", "https://example.test/README.md",
                "PLAYLIST_DEBUG", "true");

        Configuration config = new ConfigManager(file, env::get).getConfig();

        assertEquals(8, config.workerCount);
        assertEquals(1_500, config.probeTimeoutMs);
        assertEquals("https://example.test/README.md", config.indexUrl);
        assertEquals("out", config.processedDir);
        assertTrue(config.debugMode);
    }

    @Test
    void testInvalidNumberOverrideIsIgnored() {
        Configuration config = new ConfigManager(tempDir.resolve("config.json"),
                Map.of("PLAYLIST_WORKER_COUNT", "many")::get).getConfig();

        assertEquals(5, config.workerCount);
    }

    @Test
    void testBrokenFileFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

        Configuration config = new ConfigManager(file, key -> null).getConfig();

        assertNotNull(config);
        assertEquals(5, config.workerCount);
    }
}

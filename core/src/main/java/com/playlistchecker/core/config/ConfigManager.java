package com.playlistchecker.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.UnaryOperator;

/**
 * Loads {@link Configuration} from a JSON file and applies environment / system property
 * overrides on top. A missing file is created with the defaults.
 */
public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    public static final String CONFIG_PATH_KEY = "PLAYLIST_CHECKER_CONFIG";

    private final Path configFile;
    private final Gson gson;
    private final UnaryOperator<String> lookup;
    private Configuration configuration;

    public ConfigManager(Path configFile) {
        this(configFile, ConfigManager::envOrProp);
    }

    ConfigManager(Path configFile, UnaryOperator<String> lookup) {
        this.configFile = configFile;
        this.lookup = lookup;
        this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        load();
        applyOverrides();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public synchronized void save() {
        try {
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = Files.newBufferedWriter(configFile, StandardCharsets.UTF_8)) {
                gson.toJson(configuration, w);
            }
            logger.info("Configuration saved to {}", configFile);
        } catch (IOException e) {
            logger.error("Failed to save configuration to {}", configFile, e);
        }
    }

    private void load() {
        if (!Files.exists(configFile)) {
            configuration = new Configuration();
            logger.info("No config file found at {}. Created default configuration.", configFile);
            save(); // Defaults schreiben
            return;
        }

        try (Reader r = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            configuration = gson.fromJson(r, Configuration.class);
            if (configuration == null) configuration = new Configuration();
            logger.info("Configuration loaded from {}", configFile);
        } catch (Exception e) {
            logger.error("Failed to load configuration from {}, using defaults", configFile, e);
            configuration = new Configuration();
        }
    }

    private void applyOverrides() {
        Configuration c = configuration;
        c.indexUrl = string("PLAYLIST_INDEX_URL", c.indexUrl);
        c.playlistDir = string("PLAYLIST_DIR", c.playlistDir);
        c.processedDir = string("PLAYLIST_PROCESSED_DIR", c.processedDir);
        c.fetchTimeoutMs = integer("PLAYLIST_FETCH_TIMEOUT_MS", c.fetchTimeoutMs);
        c.probeTimeoutMs = integer("PLAYLIST_PROBE_TIMEOUT_MS", c.probeTimeoutMs);
        c.userAgent = string("PLAYLIST_USER_AGENT", c.userAgent);
        c.workerCount = integer("PLAYLIST_WORKER_COUNT", c.workerCount);
        c.probeParallelism = integer("PLAYLIST_PROBE_PARALLELISM", c.probeParallelism);
        c.extractor = string("PLAYLIST_EXTRACTOR", c.extractor);
        c.extractorPattern = string("PLAYLIST_EXTRACTOR_PATTERN", c.extractorPattern);
        c.metadataMarker = string("PLAYLIST_METADATA_MARKER", c.metadataMarker);
        c.urlPrefix = string("PLAYLIST_URL_PREFIX", c.urlPrefix);
        String debug = lookup.apply("PLAYLIST_DEBUG");
        if (debug != null && !debug.isBlank()) c.debugMode = Boolean.parseBoolean(debug.trim());
    }

    private String string(String key, String current) {
        String v = lookup.apply(key);
        if (v == null || v.isBlank()) return current;
        logger.debug("Override {} from environment", key);
        return v.trim();
    }

    private int integer(String key, int current) {
        String v = lookup.apply(key);
        if (v == null || v.isBlank()) return current;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring override {}={} (not a number), keeping {}", key, v, current);
            return current;
        }
    }

    static String envOrProp(String key) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        return System.getProperty(key);
    }
}

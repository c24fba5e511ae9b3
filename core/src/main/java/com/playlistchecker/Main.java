package com.playlistchecker;

import ch.qos.logback.classic.Level;
import com.playlistchecker.core.RunContext;
import com.playlistchecker.core.RunSummary;
import com.playlistchecker.core.config.ConfigManager;
import com.playlistchecker.core.config.ConfigValidator;
import com.playlistchecker.core.config.Configuration;
import com.playlistchecker.core.pipeline.PipelineManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INDEX_UNAVAILABLE = 1;
    static final int EXIT_NOTHING_TO_DO = 2;
    static final int EXIT_BAD_CONFIG = 3;
    static final int EXIT_INTERRUPTED = 4;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        logger.info("🚀 Starting PlaylistChecker...");
        logger.info("📄 Log File: logs/playlist-checker.log");

        Configuration config;
        try {
            config = new ConfigManager(resolveConfigPath(args)).getConfig();
            applyLogLevel(config);
            new ConfigValidator().validateAndReport(config);
        } catch (IllegalStateException e) {
            logger.error("CRITICAL FAILURE during startup: {}", e.getMessage());
            return EXIT_BAD_CONFIG;
        }

        try {
            RunSummary summary = new PipelineManager(RunContext.create(config)).run();
            return exitCode(summary);
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE during run", e);
            return EXIT_INDEX_UNAVAILABLE;
        }
    }

    static int exitCode(RunSummary summary) {
        switch (summary.outcome()) {
            case COMPLETED:
                logger.info("Script completed successfully");
                return EXIT_OK;
            case NOTHING_TO_DO:
                return EXIT_NOTHING_TO_DO;
            case INTERRUPTED:
                return EXIT_INTERRUPTED;
            case INDEX_UNAVAILABLE:
            default:
                return EXIT_INDEX_UNAVAILABLE;
        }
    }

    static Path resolveConfigPath(String[] args) {
        if (args != null && args.length > 0 && !args[0].isBlank()) return Paths.get(args[0]);
        String fromEnv = System.getenv(ConfigManager.CONFIG_PATH_KEY);
        if (fromEnv == null) fromEnv = System.getProperty(ConfigManager.CONFIG_PATH_KEY);
        return Paths.get(fromEnv != null && !fromEnv.isBlank() ? fromEnv : "config.json");
    }

    private static void applyLogLevel(Configuration config) {
        if (!config.debugMode) return;
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
            logger.debug("Debug logging enabled");
        }
    }
}

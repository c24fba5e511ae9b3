package com.playlistchecker.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * ConfigValidator - Validates configuration on startup.
 * Catches broken URLs, timeouts and patterns before the first request goes out.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        public boolean isError() {
            return "ERROR".equals(severity);
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    /**
     * Validate configuration and return list of errors/warnings
     */
    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validateIndexUrl(config, errors);
        validateNumbers(config, errors);
        validateDirectories(config, errors);
        validateExtractor(config, errors);
        validateParser(config, errors);

        return errors;
    }

    private void validateIndexUrl(Configuration config, List<ValidationError> errors) {
        if (config.indexUrl == null || config.indexUrl.isBlank()) {
            errors.add(new ValidationError("No index URL configured", "ERROR"));
            return;
        }
        try {
            URI uri = URI.create(config.indexUrl);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                errors.add(new ValidationError("Index URL must be http(s): " + config.indexUrl, "ERROR"));
            }
        } catch (IllegalArgumentException e) {
            errors.add(new ValidationError("Malformed index URL: " + config.indexUrl, "ERROR"));
        }
    }

    private void validateNumbers(Configuration config, List<ValidationError> errors) {
        if (config.fetchTimeoutMs <= 0) {
            errors.add(new ValidationError("fetchTimeoutMs must be positive, was " + config.fetchTimeoutMs, "ERROR"));
        }
        if (config.probeTimeoutMs <= 0) {
            errors.add(new ValidationError("probeTimeoutMs must be positive, was " + config.probeTimeoutMs, "ERROR"));
        }
        if (config.workerCount < 1) {
            errors.add(new ValidationError("workerCount must be at least 1, was " + config.workerCount, "ERROR"));
        }
        if (config.probeParallelism < 1) {
            errors.add(new ValidationError("probeParallelism must be at least 1, was " + config.probeParallelism, "ERROR"));
        }
        if (config.workerCount * Math.max(1, config.probeParallelism) > 100) {
            errors.add(new ValidationError(
                    String.format("%d workers x %d probes means more than 100 open connections",
                            config.workerCount, config.probeParallelism),
                    "WARNING"));
        }
    }

    private void validateDirectories(Configuration config, List<ValidationError> errors) {
        checkDirectory("playlistDir", config.playlistDir, errors);
        checkDirectory("processedDir", config.processedDir, errors);
    }

    private void checkDirectory(String field, String value, List<ValidationError> errors) {
        if (value == null || value.isBlank()) {
            errors.add(new ValidationError(field + " is empty", "ERROR"));
            return;
        }
        Path path = Paths.get(value);
        if (Files.exists(path) && !Files.isDirectory(path)) {
            errors.add(new ValidationError(field + " exists but is not a directory: " + value, "ERROR"));
        }
    }

    private void validateExtractor(Configuration config, List<ValidationError> errors) {
        String kind = config.extractor == null ? "" : config.extractor.trim().toLowerCase();
        if (!kind.equals("regex") && !kind.equals("html")) {
            errors.add(new ValidationError("Unknown extractor '" + config.extractor + "' (expected regex or html)", "ERROR"));
            return;
        }
        if (kind.equals("regex")) {
            if (config.extractorPattern == null || config.extractorPattern.isEmpty()) {
                errors.add(new ValidationError("extractorPattern is empty", "ERROR"));
                return;
            }
            try {
                Pattern p = Pattern.compile(config.extractorPattern);
                if (p.matcher("").groupCount() < 2) {
                    errors.add(new ValidationError("extractorPattern needs two capture groups (name, url)", "ERROR"));
                }
            } catch (PatternSyntaxException e) {
                errors.add(new ValidationError("extractorPattern does not compile: " + config.extractorPattern, "ERROR"));
            }
        }
    }

    private void validateParser(Configuration config, List<ValidationError> errors) {
        if (config.metadataMarker == null || config.metadataMarker.isEmpty()) {
            errors.add(new ValidationError("metadataMarker is empty - every line would count as metadata", "ERROR"));
        }
        if (config.urlPrefix == null || config.urlPrefix.isEmpty()) {
            errors.add(new ValidationError("urlPrefix is empty - every line would count as a URL", "ERROR"));
        }
    }

    /**
     * Validate and report errors to logger.
     * Throws IllegalStateException if critical errors found.
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.isError()) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}

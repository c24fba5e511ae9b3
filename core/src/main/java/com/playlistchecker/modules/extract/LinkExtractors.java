package com.playlistchecker.modules.extract;

import com.playlistchecker.api.LinkExtractor;
import com.playlistchecker.core.config.Configuration;

/**
 * Chooses the extraction strategy named in the configuration.
 */
public final class LinkExtractors {

    private LinkExtractors() {
    }

    public static LinkExtractor fromConfig(Configuration config) {
        String kind = config.extractor == null ? "regex" : config.extractor.trim().toLowerCase();
        switch (kind) {
            case "html":
                return new HtmlTableLinkExtractor();
            case "regex":
                return new RegexLinkExtractor(config.extractorPattern);
            default:
                throw new IllegalArgumentException("Unknown extractor: " + config.extractor);
        }
    }
}

package com.playlistchecker.modules.extract;

import com.playlistchecker.api.LinkExtractor;
import com.playlistchecker.common.util.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern based extraction. Group 1 is the display name, group 2 the playlist URL.
 * <p>
 * Duplicate names: last record wins. The map keeps the position of the first occurrence.
 */
public class RegexLinkExtractor implements LinkExtractor {
    private static final Logger logger = LoggerFactory.getLogger(RegexLinkExtractor.class);

    private final Pattern pattern;

    public RegexLinkExtractor(String regex) {
        this(Pattern.compile(regex));
    }

    public RegexLinkExtractor(Pattern pattern) {
        if (pattern.matcher("").groupCount() < 2) {
            throw new IllegalArgumentException("Pattern needs two capture groups (name, url): " + pattern);
        }
        this.pattern = pattern;
    }

    @Override
    public Map<String, String> extract(String documentText) {
        Map<String, String> links = new LinkedHashMap<>();
        if (documentText == null || documentText.isEmpty()) return links;

        logger.info("Extracting playlist links and names from document ({} chars)", documentText.length());
        Matcher m = pattern.matcher(documentText);
        while (m.find()) {
            String raw = m.group(1);
            String url = m.group(2);
            String name = NameNormalizer.normalize(raw);
            if (name.isEmpty() || url == null || url.isBlank()) {
                logger.debug("Skipping record with unusable name '{}' ({})", raw, url);
                continue;
            }
            String previous = links.put(name, url.trim());
            if (previous != null && !previous.equals(url.trim())) {
                logger.warn("Duplicate playlist name '{}': {} replaces {}", name, url.trim(), previous);
            }
        }
        logger.info("Found {} playlist links", links.size());
        return links;
    }
}

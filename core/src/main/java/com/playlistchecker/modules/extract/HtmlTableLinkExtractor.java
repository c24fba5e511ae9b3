package com.playlistchecker.modules.extract;

import com.playlistchecker.api.LinkExtractor;
import com.playlistchecker.common.util.NameNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Liest die Playlist-Tabelle mit jsoup statt Regex.
 * Eine Zeile zählt, wenn die erste Zelle Text hat und ein {@code <code>} Element mit einer
 * .m3u/.m3u8 URL enthalten ist.
 */
public class HtmlTableLinkExtractor implements LinkExtractor {
    private static final Logger logger = LoggerFactory.getLogger(HtmlTableLinkExtractor.class);

    private static final Pattern PLAYLIST_URL = Pattern.compile("^https?://\\S+\\.m3u8?$");

    @Override
    public Map<String, String> extract(String documentText) {
        Map<String, String> links = new LinkedHashMap<>();
        if (documentText == null || documentText.isEmpty()) return links;

        Document doc = Jsoup.parse(documentText);
        Elements rows = doc.select("tr");
        logger.info("Scanning {} table rows for playlist links", rows.size());

        for (Element row : rows) {
            Element firstCell = row.selectFirst("td");
            if (firstCell == null) continue;

            String url = null;
            for (Element code : row.select("code")) {
                String text = code.text().trim();
                if (PLAYLIST_URL.matcher(text).matches()) {
                    url = text;
                    break;
                }
            }
            if (url == null) continue;

            String name = NameNormalizer.normalize(firstCell.text());
            if (name.isEmpty()) {
                logger.debug("Skipping row without usable name ({})", url);
                continue;
            }
            String previous = links.put(name, url);
            if (previous != null && !previous.equals(url)) {
                logger.warn("Duplicate playlist name '{}': {} replaces {}", name, url, previous);
            }
        }
        logger.info("Found {} playlist links", links.size());
        return links;
    }
}

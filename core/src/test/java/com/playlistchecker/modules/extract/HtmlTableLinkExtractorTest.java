package com.playlistchecker.modules.extract;

import com.playlistchecker.api.LinkExtractor;
import com.playlistchecker.core.config.Configuration;
import com.playlistchecker.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HtmlTableLinkExtractorTest extends TestBase {

    private final HtmlTableLinkExtractor extractor = new HtmlTableLinkExtractor();

    @Test
    void testReadsMultiLineTable() {
        String doc = "### Grouped by country\n\n"
                + "<table>\n"
                + "  <thead><tr><th>Country</th><th>Channels</th><th>Playlist</th></tr></thead>\n"
                + "  <tbody>\n"
                + "    <tr>\n"
                + "      <td>Afghanistan&nbsp;(AF)</td>\n"
                + "      <td align=\"right\">12</td>\n"
                + "      <td nowrap><code>https://iptv-org.github.io/iptv/countries/af.m3u</code></td>\n"
                + "    </tr>\n"
                + "    <tr>\n"
                + "      <td>Albania&nbsp;(AL)</td>\n"
                + "      <td align=\"right\">30</td>\n"
                + "      <td nowrap><code>https://iptv-org.github.io/iptv/countries/al.m3u</code></td>\n"
                + "    </tr>\n"
                + "  </tbody>\n"
                + "</table>\n";

        Map<String, String> links = extractor.extract(doc);

        assertEquals(List.of("Afghanistan_AF", "Albania_AL"), List.copyOf(links.keySet()));
        assertEquals("https://iptv-org.github.io/iptv/countries/al.m3u", links.get("Albania_AL"));
    }

    @Test
    void testDuplicateNameLastOneWins() {
        String doc = "<table><tr><td>Sport</td><td><code>https://a.test/sport.m3u</code></td></tr>"
                + "<tr><td>Sport</td><td><code>https://b.test/sport.m3u8</code></td></tr></table>";

        Map<String, String> links = extractor.extract(doc);

        assertEquals(Map.of("Sport", "https://b.test/sport.m3u8"), links);
    }

    @Test
    void testRowsWithoutPlaylistUrlIgnored() {
        String doc = "<table><tr><td>Sport</td><td><code>https://a.test/sport.json</code></td></tr></table>";
        assertTrue(extractor.extract(doc).isEmpty());
        assertTrue(extractor.extract("no tables at all").isEmpty());
    }

    @Test
    void testStrategySelectionFromConfig() {
        Configuration config = new Configuration();
        config.extractor = "html";
        assertInstanceOf(HtmlTableLinkExtractor.class, LinkExtractors.fromConfig(config));

        config.extractor = "regex";
        LinkExtractor regex = LinkExtractors.fromConfig(config);
        assertInstanceOf(RegexLinkExtractor.class, regex);

        config.extractor = "yaml";
        assertThrows(IllegalArgumentException.class, () -> LinkExtractors.fromConfig(config));
    }
}

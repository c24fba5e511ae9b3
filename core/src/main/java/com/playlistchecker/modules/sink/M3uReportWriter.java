package com.playlistchecker.modules.sink;

import com.playlistchecker.api.ReportSink;
import com.playlistchecker.common.model.PlaylistEntry;
import com.playlistchecker.common.model.PlaylistReport;
import com.playlistchecker.common.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes {@code available_<name>.m3u} and {@code unavailable_<name>.m3u}.
 * Each entry becomes {@code <metadata>\n<url>}, entries are joined by a newline, an empty
 * partition gives an empty file.
 */
public class M3uReportWriter implements ReportSink {
    private static final Logger logger = LoggerFactory.getLogger(M3uReportWriter.class);

    private final Path processedDir;

    public M3uReportWriter(Path processedDir) {
        this.processedDir = processedDir;
    }

    public Path availableFile(String name) {
        return processedDir.resolve("available_" + name + ".m3u");
    }

    public Path unavailableFile(String name) {
        return processedDir.resolve("unavailable_" + name + ".m3u");
    }

    @Override
    public Void process(PlaylistReport report) throws IOException {
        IOException failure = null;
        try {
            write(availableFile(report.name()), report.availableEntries());
            logger.info("Saved available links for '{}' to {}", report.name(), availableFile(report.name()));
        } catch (IOException e) {
            failure = e;
        }
        try {
            write(unavailableFile(report.name()), report.unavailableEntries());
            logger.info("Saved unavailable links for '{}' to {}", report.name(), unavailableFile(report.name()));
        } catch (IOException e) {
            if (failure == null) failure = e;
            else failure.addSuppressed(e);
        }
        if (failure != null) throw failure;
        return null;
    }

    static String format(List<PlaylistEntry> entries) {
        return entries.stream().map(PlaylistEntry::toM3u).collect(Collectors.joining("\n"));
    }

    private void write(Path target, List<PlaylistEntry> entries) throws IOException {
        FileUtils.writeAtomically(target, format(entries));
    }
}

package com.playlistchecker.core;

import com.playlistchecker.api.LinkExtractor;
import com.playlistchecker.api.LivenessProber;
import com.playlistchecker.api.ReportSink;
import com.playlistchecker.api.ResourceFetcher;
import com.playlistchecker.core.config.Configuration;
import com.playlistchecker.modules.extract.LinkExtractors;
import com.playlistchecker.modules.playlist.M3uParser;
import com.playlistchecker.modules.sink.M3uReportWriter;
import com.playlistchecker.services.http.HttpLivenessProber;
import com.playlistchecker.services.http.HttpResourceFetcher;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Everything one run needs, wired once and handed to the {@link com.playlistchecker.core.pipeline.PipelineManager}.
 * Lives exactly as long as the run; nothing in here is static.
 */
public class RunContext {

    private final Configuration config;
    private final ResourceFetcher fetcher;
    private final LivenessProber prober;
    private final LinkExtractor extractor;
    private final M3uParser parser;
    private final ReportSink sink;

    public RunContext(Configuration config,
                      ResourceFetcher fetcher,
                      LivenessProber prober,
                      LinkExtractor extractor,
                      M3uParser parser,
                      ReportSink sink) {
        this.config = config;
        this.fetcher = fetcher;
        this.prober = prober;
        this.extractor = extractor;
        this.parser = parser;
        this.sink = sink;
    }

    /**
     * Standard-Verdrahtung: HTTP für Abruf und Probe, Dateien als Ausgabe.
     */
    public static RunContext create(Configuration config) {
        return new RunContext(
                config,
                new HttpResourceFetcher(config.userAgent),
                new HttpLivenessProber(config.userAgent),
                LinkExtractors.fromConfig(config),
                new M3uParser(config.metadataMarker, config.urlPrefix),
                new M3uReportWriter(Paths.get(config.processedDir)));
    }

    public Configuration getConfig() {
        return config;
    }

    public ResourceFetcher getFetcher() {
        return fetcher;
    }

    public LivenessProber getProber() {
        return prober;
    }

    public LinkExtractor getExtractor() {
        return extractor;
    }

    public M3uParser getParser() {
        return parser;
    }

    public ReportSink getSink() {
        return sink;
    }

    public Path getPlaylistDir() {
        return Paths.get(config.playlistDir);
    }

    public Path getProcessedDir() {
        return Paths.get(config.processedDir);
    }
}

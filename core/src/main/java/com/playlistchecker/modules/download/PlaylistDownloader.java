package com.playlistchecker.modules.download;

import com.playlistchecker.api.ResourceFetcher;
import com.playlistchecker.common.util.FileUtils;
import com.playlistchecker.core.pipeline.PipelineItem;
import com.playlistchecker.core.pipeline.StageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Download stage: fetches the playlist and stores it as {@code <playlistDir>/<name>.m3u}.
 */
public class PlaylistDownloader implements StageHandler<PipelineItem, Path> {
    private static final Logger logger = LoggerFactory.getLogger(PlaylistDownloader.class);

    private final ResourceFetcher fetcher;
    private final Path playlistDir;
    private final int timeoutMs;

    public PlaylistDownloader(ResourceFetcher fetcher, Path playlistDir, int timeoutMs) {
        this.fetcher = fetcher;
        this.playlistDir = playlistDir;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Path process(PipelineItem item) throws Exception {
        logger.info("⬇️ Downloading playlist '{}' from {}", item.getName(), item.getSourceUrl());
        String text = fetcher.fetchText(item.getSourceUrl(), timeoutMs);

        Path target = playlistDir.resolve(item.getName() + ".m3u");
        FileUtils.writeAtomically(target, text);
        logger.info("Saved playlist to {}", target);
        return target;
    }
}

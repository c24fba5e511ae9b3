package com.playlistchecker.core.pipeline;

import com.playlistchecker.api.FetchException;
import com.playlistchecker.common.model.NamedResource;
import com.playlistchecker.common.model.PlaylistReport;
import com.playlistchecker.common.util.FileUtils;
import com.playlistchecker.core.RunContext;
import com.playlistchecker.core.RunSummary;
import com.playlistchecker.core.config.Configuration;
import com.playlistchecker.core.queue.QueueManager;
import com.playlistchecker.core.queue.QueueTask;
import com.playlistchecker.modules.download.PlaylistDownloader;
import com.playlistchecker.modules.playlist.PlaylistValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one run: index fetch, link extraction, playlist downloads, then validation and
 * persistence of every playlist on the bounded worker pool.
 * <p>
 * Failures below the index level stay with their playlist; the run always waits for every
 * submitted task before it reports.
 */
public class PipelineManager {
    private static final Logger logger = LoggerFactory.getLogger(PipelineManager.class);

    private final RunContext context;
    private final StageHandler<PipelineItem, Path> downloadHandler;
    private final StageHandler<PipelineItem, PlaylistReport> processingHandler;

    public PipelineManager(RunContext context) {
        this.context = context;
        Configuration config = context.getConfig();
        this.downloadHandler = new PlaylistDownloader(context.getFetcher(), context.getPlaylistDir(), config.fetchTimeoutMs);
        this.processingHandler = new PlaylistValidator(context.getParser(), context.getProber(),
                config.probeTimeoutMs, config.probeParallelism);
    }

    public RunSummary run() {
        Configuration config = context.getConfig();
        logger.info("🚀 Starting playlist check (index: {})", config.indexUrl);

        prepareDirectories();

        String document;
        try {
            logger.info("Fetching index document from {}", config.indexUrl);
            document = context.getFetcher().fetchText(config.indexUrl, config.fetchTimeoutMs);
            logger.info("Successfully fetched index document");
        } catch (FetchException e) {
            logger.error("❌ Failed to fetch index document {}: {}", e.getUrl(), e.getMessage());
            return RunSummary.indexUnavailable();
        }

        Map<String, String> links = context.getExtractor().extract(document);
        if (links.isEmpty()) {
            logger.warn("No playlist links found in index document. Nothing to do.");
            return RunSummary.nothingToDo();
        }

        Map<String, String> failures = new LinkedHashMap<>();
        List<PlaylistReport> reports = new ArrayList<>();
        Map<QueueTask, PipelineItem> items = new IdentityHashMap<>();

        RunSummary.Outcome outcome = RunSummary.Outcome.COMPLETED;
        QueueManager queue = new QueueManager(config.workerCount);
        try {
            for (Map.Entry<String, String> link : links.entrySet()) {
                PipelineItem item = new PipelineItem(new NamedResource(link.getKey(), link.getValue()));
                if (!download(item, failures)) continue;

                QueueTask task = new QueueTask(item.getName());
                item.setParentTask(task);
                items.put(task, item);
                queue.submit(task, t -> processItem(item));
            }

            for (QueueTask task : queue.awaitAll()) {
                PipelineItem item = items.get(task);
                if (task.getStatus() == QueueTask.Status.DONE && item.getReport() != null) {
                    reports.add(item.getReport());
                } else {
                    failures.put(task.getName(), describe(task.getError()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = RunSummary.Outcome.INTERRUPTED;
            logger.warn("Run interrupted, {} playlists not accounted for", links.size() - reports.size() - failures.size());
        } finally {
            queue.shutdown();
        }

        RunSummary summary = new RunSummary(outcome, links.size(), reports, failures);
        logSummary(summary);
        return summary;
    }

    private void prepareDirectories() {
        try {
            FileUtils.ensureDirectory(context.getPlaylistDir());
            FileUtils.ensureDirectory(context.getProcessedDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directories", e);
        }
    }

    private boolean download(PipelineItem item, Map<String, String> failures) {
        try {
            item.setDownloadedFile(downloadHandler.process(item));
            return true;
        } catch (Exception e) {
            logger.error("Failed to download playlist '{}' from {}: {}", item.getName(), item.getSourceUrl(), e.getMessage());
            failures.put(item.getName(), "download: " + e.getMessage());
            return false;
        }
    }

    private void processItem(PipelineItem item) throws Exception {
        PlaylistReport report = processingHandler.process(item);
        try {
            context.getSink().process(report);
        } catch (Exception e) {
            logger.error("Failed to persist results for '{}': {}", item.getName(), e.getMessage());
            throw e;
        }
        item.setReport(report);
        logger.info("✅ Playlist '{}' done: {} available, {} unavailable ({} probe failures)",
                report.name(), report.available().size(), report.unavailable().size(), report.probeFailedCount());
    }

    private static String describe(Throwable error) {
        if (error == null) return "unknown failure";
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private void logSummary(RunSummary summary) {
        logger.info("📋 Run finished: {} playlists found, {} processed, {} failed",
                summary.playlistsFound(), summary.reports().size(), summary.failures().size());
        logger.info("📋 Entries: {} available, {} unavailable ({} probe failures)",
                summary.availableCount(), summary.unavailableCount(), summary.probeFailedCount());
        summary.failures().forEach((name, reason) -> logger.warn("Failed playlist '{}': {}", name, reason));
    }
}

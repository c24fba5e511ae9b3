package com.playlistchecker.modules.playlist;

import com.playlistchecker.api.LivenessProber;
import com.playlistchecker.common.model.PlaylistEntry;
import com.playlistchecker.common.model.PlaylistReport;
import com.playlistchecker.common.model.ProbeResult;
import com.playlistchecker.common.model.ProbedEntry;
import com.playlistchecker.core.pipeline.PipelineItem;
import com.playlistchecker.core.pipeline.StageHandler;
import com.playlistchecker.core.queue.QueueTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Processing stage: parses the downloaded playlist and probes every entry.
 * <p>
 * With {@code probeParallelism > 1} the entries of this one playlist are probed on a private pool;
 * results are always collected in parse order.
 */
public class PlaylistValidator implements StageHandler<PipelineItem, PlaylistReport> {
    private static final Logger logger = LoggerFactory.getLogger(PlaylistValidator.class);
    private static final int PROGRESS_STEP = 25;

    private final M3uParser parser;
    private final LivenessProber prober;
    private final int probeTimeoutMs;
    private final int probeParallelism;

    public PlaylistValidator(M3uParser parser, LivenessProber prober, int probeTimeoutMs, int probeParallelism) {
        this.parser = parser;
        this.prober = prober;
        this.probeTimeoutMs = probeTimeoutMs;
        this.probeParallelism = Math.max(1, probeParallelism);
    }

    @Override
    public PlaylistReport process(PipelineItem item) throws Exception {
        Path file = item.getDownloadedFile();
        if (file == null) {
            throw new IOException("No downloaded file for playlist '" + item.getName() + "'");
        }
        logger.info("🔎 Processing playlist file: {}", file);

        String text = Files.readString(file, StandardCharsets.UTF_8);
        List<PlaylistEntry> entries = parser.parse(text);

        QueueTask task = item.getParentTask();
        if (task != null) task.setTotalItems(entries.size());
        logger.info("Playlist '{}': {} entries to check", item.getName(), entries.size());

        List<ProbedEntry> results = probeParallelism > 1 && entries.size() > 1
                ? probeConcurrently(entries, task)
                : probeSequentially(entries, task);

        return PlaylistReport.of(item.getName(), results);
    }

    private List<ProbedEntry> probeSequentially(List<PlaylistEntry> entries, QueueTask task) {
        List<ProbedEntry> results = new ArrayList<>(entries.size());
        for (PlaylistEntry entry : entries) {
            results.add(new ProbedEntry(entry, probe(entry)));
            reportProgress(task);
        }
        return results;
    }

    private List<ProbedEntry> probeConcurrently(List<PlaylistEntry> entries, QueueTask task) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(probeParallelism, entries.size()));
        try {
            List<Future<ProbeResult>> futures = new ArrayList<>(entries.size());
            for (PlaylistEntry entry : entries) {
                futures.add(pool.submit(() -> {
                    ProbeResult r = probe(entry);
                    reportProgress(task);
                    return r;
                }));
            }

            List<ProbedEntry> results = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                ProbeResult r;
                try {
                    r = futures.get(i).get();
                } catch (ExecutionException e) {
                    logger.warn("Probe for {} aborted: {}", entries.get(i).url(), e.getCause().toString());
                    r = ProbeResult.PROBE_FAILED;
                }
                results.add(new ProbedEntry(entries.get(i), r));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private void reportProgress(QueueTask task) {
        if (task == null) return;
        int done = task.incrementProcessed();
        if (done % PROGRESS_STEP == 0 || done == task.getTotalItems()) {
            logger.info("⏳ {}", task);
        }
    }

    private ProbeResult probe(PlaylistEntry entry) {
        try {
            ProbeResult r = prober.probe(entry.url(), probeTimeoutMs);
            return r != null ? r : ProbeResult.PROBE_FAILED;
        } catch (RuntimeException e) {
            logger.warn("Prober threw for {}: {}", entry.url(), e.toString());
            return ProbeResult.PROBE_FAILED;
        }
    }
}

package com.playlistchecker.core.pipeline;

import com.playlistchecker.common.model.NamedResource;
import com.playlistchecker.common.model.PlaylistReport;
import com.playlistchecker.core.queue.QueueTask;

import java.nio.file.Path;

/**
 * Zustand einer Playlist auf dem Weg durch die Pipeline.
 * Wird genau von einem Task besessen, daher keine Synchronisierung.
 */
public class PipelineItem {

    private final NamedResource resource;

    // Status-Felder
    private Path downloadedFile;
    private PlaylistReport report;
    private QueueTask parentTask;

    public PipelineItem(NamedResource resource) {
        this.resource = resource;
    }

    public String getName() {
        return resource.name();
    }

    public String getSourceUrl() {
        return resource.url();
    }

    public void setDownloadedFile(Path f) {
        this.downloadedFile = f;
    }

    public Path getDownloadedFile() {
        return downloadedFile;
    }

    public void setReport(PlaylistReport report) {
        this.report = report;
    }

    public PlaylistReport getReport() {
        return report;
    }

    public void setParentTask(QueueTask parentTask) {
        this.parentTask = parentTask;
    }

    public QueueTask getParentTask() {
        return parentTask;
    }
}

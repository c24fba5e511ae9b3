package com.playlistchecker.api;

import com.playlistchecker.common.model.PlaylistReport;
import com.playlistchecker.core.pipeline.StageHandler;

/**
 * Ausgabemodul für fertige Reports (z.B. lokale m3u-Dateien).
 */
public interface ReportSink extends StageHandler<PlaylistReport, Void> {
    // StageHandler definiert bereits: Void process(PlaylistReport report)
}

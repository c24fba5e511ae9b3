package com.playlistchecker.core;

import com.playlistchecker.common.model.PlaylistReport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one run.
 *
 * @param outcome        how the run ended
 * @param playlistsFound records extracted from the index document
 * @param reports        reports that were fully persisted
 * @param failures       playlist name to failure description, for every playlist that produced no output
 */
public record RunSummary(
        Outcome outcome,
        int playlistsFound,
        List<PlaylistReport> reports,
        Map<String, String> failures
) {
    public enum Outcome {
        /** Every discovered playlist was processed or accounted for as failed. */
        COMPLETED,
        /** The index document had no matching records. */
        NOTHING_TO_DO,
        /** The index document could not be fetched. */
        INDEX_UNAVAILABLE,
        /** Interrupted before every submitted playlist was accounted for. */
        INTERRUPTED
    }

    public RunSummary {
        reports = List.copyOf(reports);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public static RunSummary indexUnavailable() {
        return new RunSummary(Outcome.INDEX_UNAVAILABLE, 0, List.of(), Map.of());
    }

    public static RunSummary nothingToDo() {
        return new RunSummary(Outcome.NOTHING_TO_DO, 0, List.of(), Map.of());
    }

    public boolean isFatal() {
        return outcome != Outcome.COMPLETED;
    }

    public int availableCount() {
        return reports.stream().mapToInt(r -> r.available().size()).sum();
    }

    public int unavailableCount() {
        return reports.stream().mapToInt(r -> r.unavailable().size()).sum();
    }

    public long probeFailedCount() {
        return reports.stream().mapToLong(PlaylistReport::probeFailedCount).sum();
    }
}

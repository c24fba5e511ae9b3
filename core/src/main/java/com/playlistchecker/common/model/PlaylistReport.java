package com.playlistchecker.common.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitioned probe results of one playlist.
 * Both lists keep parse order; {@code PROBE_FAILED} entries land in {@code unavailable}
 * but keep their tag for diagnostics.
 */
public record PlaylistReport(
        String name,
        List<ProbedEntry> available,
        List<ProbedEntry> unavailable
) {
    public PlaylistReport {
        available = List.copyOf(available);
        unavailable = List.copyOf(unavailable);
    }

    /**
     * Stable partition of {@code results} (already in parse order).
     */
    public static PlaylistReport of(String name, List<ProbedEntry> results) {
        List<ProbedEntry> up = new ArrayList<>();
        List<ProbedEntry> down = new ArrayList<>();
        for (ProbedEntry r : results) {
            if (r.result().isAvailable()) up.add(r);
            else down.add(r);
        }
        return new PlaylistReport(name, up, down);
    }

    public List<PlaylistEntry> availableEntries() {
        return available.stream().map(ProbedEntry::entry).toList();
    }

    public List<PlaylistEntry> unavailableEntries() {
        return unavailable.stream().map(ProbedEntry::entry).toList();
    }

    public long probeFailedCount() {
        return unavailable.stream().filter(r -> r.result() == ProbeResult.PROBE_FAILED).count();
    }

    public int totalEntries() {
        return available.size() + unavailable.size();
    }
}

package com.playlistchecker.common.model;

/**
 * Outcome of a single liveness probe.
 */
public enum ProbeResult {
    /** Completed with a success status. */
    REACHABLE,
    /** Completed with any other status. */
    UNREACHABLE,
    /** The check itself could not complete (timeout, DNS, connection refused). */
    PROBE_FAILED;

    public boolean isAvailable() {
        return this == REACHABLE;
    }
}

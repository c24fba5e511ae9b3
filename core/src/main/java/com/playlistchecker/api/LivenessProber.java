package com.playlistchecker.api;

import com.playlistchecker.common.model.ProbeResult;

/**
 * Existence check for a single URL without transferring the body.
 * Implementations never throw; every failure is expressed as a {@link ProbeResult}.
 */
public interface LivenessProber {
    ProbeResult probe(String url, int timeoutMs);
}

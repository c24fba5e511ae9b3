package com.playlistchecker.common.model;

public record ProbedEntry(
        PlaylistEntry entry,
        ProbeResult result
) {}

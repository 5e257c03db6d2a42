package com.prospect.leadengine.qualify.api;

public record DaemonStatusResponse(
    boolean jobChangeRunning,
    boolean playlistRefreshRunning
) {
}

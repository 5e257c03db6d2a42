package com.prospect.leadengine.qualify.playlist;

import java.time.Instant;

public record PlaylistRefreshResult(long playlistId, String name, boolean refreshed, int memberCount, Instant refreshedAt) {
}

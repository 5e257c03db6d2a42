package com.prospect.leadengine.qualify.playlist;

import java.time.Duration;
import java.time.Instant;

public record Playlist(
    Long id,
    String name,
    String description,
    PlaylistType type,
    PlaylistCriteria criteria,
    int targetSize,
    int refreshHours,
    String ownerId,
    PlaylistStatus status,
    Instant createdAt,
    Instant lastRefreshedAt
) {
    public boolean isActive() {
        return status != PlaylistStatus.ARCHIVED;
    }

    public boolean isDynamic() {
        return type != PlaylistType.STATIC;
    }

    /**
     * True for an active dynamic playlist that was never refreshed or whose cadence has elapsed.
     */
    public boolean isDueForRefresh(Instant now) {
        if (!isActive() || !isDynamic()) {
            return false;
        }
        if (lastRefreshedAt == null) {
            return true;
        }
        return !lastRefreshedAt.plus(Duration.ofHours(Math.max(1, refreshHours))).isAfter(now);
    }

    public Playlist withId(Long newId) {
        return new Playlist(
            newId, name, description, type, criteria, targetSize, refreshHours, ownerId, status, createdAt, lastRefreshedAt
        );
    }
}

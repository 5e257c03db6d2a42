package com.prospect.leadengine.qualify.playlist;

import java.util.List;

/**
 * Input for creating a playlist. Null target size or cadence fall back to configured defaults; static playlists
 * may name their initial members.
 */
public record PlaylistDraft(
    String name,
    String description,
    PlaylistType type,
    PlaylistCriteria criteria,
    Integer targetSize,
    Integer refreshHours,
    String ownerId,
    List<Long> leadIds
) {
    public PlaylistDraft {
        leadIds = leadIds == null ? List.of() : List.copyOf(leadIds);
    }
}

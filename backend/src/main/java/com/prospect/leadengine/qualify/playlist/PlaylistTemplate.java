package com.prospect.leadengine.qualify.playlist;

/**
 * A named, ready-made playlist definition offered to users as a recommendation.
 */
public record PlaylistTemplate(
    String key,
    String name,
    String description,
    PlaylistCriteria criteria,
    String reasoning
) {
}

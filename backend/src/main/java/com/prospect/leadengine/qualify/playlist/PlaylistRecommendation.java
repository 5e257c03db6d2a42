package com.prospect.leadengine.qualify.playlist;

public record PlaylistRecommendation(
    PlaylistTemplate template,
    int estimatedLeads,
    double confidence,
    PlaylistType playlistType
) {
}

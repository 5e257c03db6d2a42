package com.prospect.leadengine.qualify.playlist;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Membership and outreach figures for one playlist. {@code engagementByAction} is keyed by action type.
 */
public record PlaylistPerformance(
    long playlistId,
    String name,
    String description,
    Instant createdAt,
    Instant lastRefreshedAt,
    long totalLeads,
    double averageScore,
    long hotLeads,
    long warmLeads,
    long contactedLeads,
    double contactRate,
    Map<String, EngagementStats> engagementByAction
) {
    public PlaylistPerformance {
        engagementByAction = engagementByAction == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(engagementByAction));
    }
}

package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.PriorityTier;

import java.time.Instant;
import java.util.List;

public record DailyLeadRecommendation(
    Lead lead,
    double score,
    PriorityTier priority,
    String sourcePlaylist,
    String reasoning,
    List<String> suggestedActions,
    Instant recommendedAt
) {
    public DailyLeadRecommendation {
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }
}

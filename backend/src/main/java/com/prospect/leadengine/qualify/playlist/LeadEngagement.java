package com.prospect.leadengine.qualify.playlist;

import java.time.Instant;

/**
 * One recorded touch on a playlist member, e.g. an email or a call, with its outcome when known.
 */
public record LeadEngagement(
    Long id,
    long playlistId,
    long leadId,
    String userId,
    String actionType,
    String outcome,
    String notes,
    Instant actionAt
) {
    public static final String POSITIVE_OUTCOME = "positive";
}

package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.qualify.model.PriorityTier;

import java.time.Instant;

/**
 * Membership row. Score and priority are a snapshot taken when the lead was added.
 */
public record PlaylistMember(
    Long id,
    long playlistId,
    long leadId,
    String companyName,
    double score,
    PriorityTier priority,
    Instant addedAt,
    MemberStatus status
) {
}

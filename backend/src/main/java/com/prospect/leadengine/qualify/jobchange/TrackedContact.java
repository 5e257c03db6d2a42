package com.prospect.leadengine.qualify.jobchange;

import java.time.Instant;

/**
 * A decision maker under observation. The {@code original*} fields are copied from the lead when tracking began
 * and never change afterwards.
 */
public record TrackedContact(
    Long id,
    String name,
    String profileUrl,
    String email,
    String phone,
    String currentCompany,
    String currentRole,
    String originalCompany,
    String originalRole,
    double originalLeadScore,
    Instant addedAt,
    Instant lastCheckedAt,
    ContactStatus status
) {
    public boolean isActive() {
        return status != ContactStatus.INACTIVE;
    }
}

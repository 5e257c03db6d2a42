package com.prospect.leadengine.qualify.jobchange;

import java.time.Instant;

public record JobChangeEvent(
    Long id,
    long contactId,
    String previousCompany,
    String newCompany,
    String previousRole,
    String newRole,
    ChangeType changeType,
    Instant detectedAt,
    double opportunityScore,
    AlertStatus alertStatus
) {
}

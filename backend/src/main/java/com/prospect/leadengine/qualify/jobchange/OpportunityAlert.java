package com.prospect.leadengine.qualify.jobchange;

import java.time.Instant;
import java.util.List;

public record OpportunityAlert(
    long eventId,
    AlertPriority priority,
    String contactName,
    String profileUrl,
    String previousCompany,
    String newCompany,
    String newRole,
    ChangeType changeType,
    double opportunityScore,
    Instant detectedAt,
    String message,
    List<String> actionItems
) {
    public OpportunityAlert {
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    }
}

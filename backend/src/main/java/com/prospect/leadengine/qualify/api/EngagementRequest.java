package com.prospect.leadengine.qualify.api;

public record EngagementRequest(
    String userId,
    String actionType,
    String outcome,
    String notes
) {
}

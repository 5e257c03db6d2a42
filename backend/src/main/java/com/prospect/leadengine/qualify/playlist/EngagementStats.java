package com.prospect.leadengine.qualify.playlist;

public record EngagementStats(long count, long positiveOutcomes) {
}

package com.prospect.leadengine.qualify.scoring;

import com.prospect.leadengine.qualify.model.Lead;

/**
 * Outcome of scoring one lead. A failed result still carries the lead, with a zero score.
 */
public record ScoringResult(
    Lead lead,
    String error
) {
    public static ScoringResult success(Lead lead) {
        return new ScoringResult(lead, null);
    }

    public static ScoringResult failure(Lead lead, String error) {
        return new ScoringResult(lead, error == null || error.isBlank() ? "scoring_failed" : error);
    }

    public boolean isSuccessful() {
        return error == null;
    }
}

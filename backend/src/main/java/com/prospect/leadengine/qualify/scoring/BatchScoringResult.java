package com.prospect.leadengine.qualify.scoring;

import com.prospect.leadengine.qualify.model.Lead;

import java.util.List;

/**
 * @param leads    every input lead, scored (failures at zero), ordered by score descending; equal scores keep
 *                 their input order
 * @param failures per-record failures, in input order
 */
public record BatchScoringResult(
    List<Lead> leads,
    List<ScoringFailure> failures
) {
    public record ScoringFailure(
        int inputIndex,
        String companyName,
        String error
    ) {
    }

    public int successCount() {
        return leads.size() - failures.size();
    }
}

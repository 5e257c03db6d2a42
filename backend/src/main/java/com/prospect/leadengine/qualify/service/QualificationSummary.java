package com.prospect.leadengine.qualify.service;

import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.PriorityTier;
import com.prospect.leadengine.qualify.scoring.BatchScoringResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record QualificationSummary(
    Instant startedAt,
    Instant finishedAt,
    int received,
    int enriched,
    int scored,
    int saved,
    int contactsTracked,
    Map<PriorityTier, Long> countsByPriority,
    List<BatchScoringResult.ScoringFailure> failures,
    List<Lead> leads
) {
    public QualificationSummary {
        countsByPriority = countsByPriority == null ? Map.of() : Map.copyOf(countsByPriority);
        failures = failures == null ? List.of() : List.copyOf(failures);
        leads = leads == null ? List.of() : List.copyOf(leads);
    }
}

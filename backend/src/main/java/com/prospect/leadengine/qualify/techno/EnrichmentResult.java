package com.prospect.leadengine.qualify.techno;

import com.prospect.leadengine.qualify.model.Lead;

import java.util.List;

public record EnrichmentResult(
    Lead lead,
    TechnologyProfile profile,
    List<MigrationOpportunity> opportunities,
    IntentSignals intentSignals
) {
    public EnrichmentResult {
        profile = profile == null ? TechnologyProfile.empty() : profile;
        opportunities = opportunities == null ? List.of() : List.copyOf(opportunities);
        intentSignals = intentSignals == null ? IntentSignals.none() : intentSignals;
    }

    public static EnrichmentResult unchanged(Lead lead) {
        return new EnrichmentResult(lead, TechnologyProfile.empty(), List.of(), IntentSignals.none());
    }

    public boolean enriched() {
        return !profile.isEmpty();
    }
}

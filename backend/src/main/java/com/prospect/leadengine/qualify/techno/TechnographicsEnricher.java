package com.prospect.leadengine.qualify.techno;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.model.CloudMaturity;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.TechnographicSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class TechnographicsEnricher {
    private static final Logger log = LoggerFactory.getLogger(TechnographicsEnricher.class);
    private static final int MAX_OPPORTUNITY_PAIN_POINTS = 3;

    private final WebsiteTechInspector inspector;
    private final TechnographicClassifier classifier;
    private final LeadEngineProperties properties;
    private final ExecutorService enrichmentExecutor;

    public TechnographicsEnricher(
        WebsiteTechInspector inspector,
        TechnographicClassifier classifier,
        LeadEngineProperties properties,
        @Qualifier("enrichmentExecutor") ExecutorService enrichmentExecutor
    ) {
        this.inspector = inspector;
        this.classifier = classifier;
        this.properties = properties;
        this.enrichmentExecutor = enrichmentExecutor;
    }

    /**
     * Inspects the lead's website (or falls back to the technologies it already lists) and folds the result into
     * a copy of the lead. Leads without any signal are returned unchanged.
     */
    public EnrichmentResult enrich(Lead lead) {
        TechnologyProfile profile = TechnologyProfile.empty();
        if (properties.getTechnographics().isEnabled() && lead.hasWebsite()) {
            profile = inspector.inspect(lead.website());
        }
        if (profile.isEmpty() && !lead.technologies().isEmpty()) {
            profile = TechSignatureCatalog.profileFromNames(lead.technologies());
        }
        if (profile.isEmpty()) {
            return EnrichmentResult.unchanged(lead);
        }
        return apply(lead, profile);
    }

    EnrichmentResult apply(Lead lead, TechnologyProfile profile) {
        CloudMaturity maturity = classifier.maturity(profile);
        List<MigrationOpportunity> opportunities = classifier.migrationOpportunities(profile);
        IntentSignals intent = classifier.intentSignals(profile);

        Set<String> technologies = new LinkedHashSet<>(lead.technologies());
        technologies.addAll(profile.technologies());

        String competitor = lead.competitorCloud();
        if ((competitor == null || competitor.isBlank()) && !profile.competingProviders().isEmpty()) {
            competitor = profile.competingProviders().get(0);
        }

        List<String> painPoints = new ArrayList<>(lead.painPoints());
        int added = 0;
        for (MigrationOpportunity opportunity : opportunities) {
            if (added >= MAX_OPPORTUNITY_PAIN_POINTS) {
                break;
            }
            if (!painPoints.contains(opportunity.description())) {
                painPoints.add(opportunity.description());
            }
            added++;
        }

        Lead enriched = lead.toBuilder()
            .technologies(new ArrayList<>(technologies))
            .cloudMaturity(maturity)
            .usesTargetCloud(lead.usesTargetCloud() || profile.hasTargetProvider())
            .competitorCloud(competitor)
            .painPoints(painPoints)
            .technographics(summarize(profile, intent))
            .build();
        return new EnrichmentResult(enriched, profile, opportunities, intent);
    }

    static TechnographicSummary summarize(TechnologyProfile profile, IntentSignals intent) {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        for (Map.Entry<TechCategory, List<String>> entry : profile.categories().entrySet()) {
            categories.put(entry.getKey().value(), entry.getValue());
        }
        List<TechnographicSummary.IntentIndicator> indicators = new ArrayList<>();
        for (IntentSignals.Indicator indicator : intent.indicators()) {
            indicators.add(new TechnographicSummary.IntentIndicator(indicator.reason(), indicator.points()));
        }
        return new TechnographicSummary(
            categories,
            profile.targetCloudServices(),
            intent.score(),
            intent.urgency().value(),
            indicators
        );
    }

    /**
     * Enriches every lead on the enrichment pool. Output order matches input order; a failing lead comes back
     * unchanged.
     */
    public List<EnrichmentResult> enrichAll(List<Lead> leads) {
        if (leads == null || leads.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<EnrichmentResult>> futures = new ArrayList<>();
        for (Lead lead : leads) {
            futures.add(CompletableFuture.supplyAsync(() -> enrich(lead), enrichmentExecutor));
        }
        List<EnrichmentResult> results = new ArrayList<>(leads.size());
        int enrichedCount = 0;
        for (int i = 0; i < futures.size(); i++) {
            Lead lead = leads.get(i);
            try {
                EnrichmentResult result = futures.get(i).join();
                if (result.enriched()) {
                    enrichedCount++;
                }
                results.add(result);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Technographic enrichment failed for {}", lead.companyName(), cause);
                results.add(EnrichmentResult.unchanged(lead));
            }
        }
        log.info("Technographic enrichment finished: {} of {} leads enriched", enrichedCount, leads.size());
        return results;
    }
}

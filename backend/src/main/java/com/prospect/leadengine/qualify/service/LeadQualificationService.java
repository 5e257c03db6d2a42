package com.prospect.leadengine.qualify.service;

import com.prospect.leadengine.qualify.jobchange.JobChangeMonitorService;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.PriorityTier;
import com.prospect.leadengine.qualify.persistence.LeadRepository;
import com.prospect.leadengine.qualify.scoring.BatchScoringResult;
import com.prospect.leadengine.qualify.scoring.LeadScorer;
import com.prospect.leadengine.qualify.techno.EnrichmentResult;
import com.prospect.leadengine.qualify.techno.TechnographicsEnricher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs raw leads through enrichment, scoring, persistence and contact tracking.
 */
@Service
public class LeadQualificationService {
    private static final Logger log = LoggerFactory.getLogger(LeadQualificationService.class);

    private final TechnographicsEnricher enricher;
    private final LeadScorer scorer;
    private final LeadRepository leadRepository;
    private final JobChangeMonitorService jobChangeMonitorService;

    public LeadQualificationService(
        TechnographicsEnricher enricher,
        LeadScorer scorer,
        LeadRepository leadRepository,
        JobChangeMonitorService jobChangeMonitorService
    ) {
        this.enricher = enricher;
        this.scorer = scorer;
        this.leadRepository = leadRepository;
        this.jobChangeMonitorService = jobChangeMonitorService;
    }

    public QualificationSummary qualify(List<Lead> rawLeads, boolean enrich) {
        Instant startedAt = Instant.now();
        List<Lead> input = rawLeads == null ? List.of() : rawLeads;
        List<Lead> candidates = input;
        int enrichedCount = 0;
        if (enrich && !input.isEmpty()) {
            candidates = new ArrayList<>(input.size());
            for (EnrichmentResult result : enricher.enrichAll(input)) {
                if (result.enriched()) {
                    enrichedCount++;
                }
                candidates.add(result.lead());
            }
        }

        BatchScoringResult batch = scorer.scoreBatch(candidates);
        List<Lead> persistable = new ArrayList<>();
        for (Lead lead : batch.leads()) {
            if (lead.companyName() != null && !lead.companyName().isBlank()) {
                persistable.add(lead);
            }
        }
        List<Lead> saved = leadRepository.saveAll(persistable);
        int contactsTracked = jobChangeMonitorService.trackContacts(saved);

        Map<PriorityTier, Long> counts = new EnumMap<>(PriorityTier.class);
        for (PriorityTier tier : PriorityTier.values()) {
            counts.put(tier, 0L);
        }
        for (Lead lead : saved) {
            counts.merge(lead.priority(), 1L, Long::sum);
        }

        QualificationSummary summary = new QualificationSummary(
            startedAt,
            Instant.now(),
            input.size(),
            enrichedCount,
            batch.successCount(),
            saved.size(),
            contactsTracked,
            counts,
            batch.failures(),
            saved
        );
        log.info(
            "Qualification run finished: received={} enriched={} scored={} saved={} hot={} warm={} failures={}",
            summary.received(),
            summary.enriched(),
            summary.scored(),
            summary.saved(),
            counts.get(PriorityTier.HOT),
            counts.get(PriorityTier.WARM),
            summary.failures().size()
        );
        return summary;
    }
}

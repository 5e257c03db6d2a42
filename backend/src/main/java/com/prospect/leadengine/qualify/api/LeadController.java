package com.prospect.leadengine.qualify.api;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.persistence.LeadRepository;
import com.prospect.leadengine.qualify.scoring.BatchScoringResult;
import com.prospect.leadengine.qualify.scoring.LeadScorer;
import com.prospect.leadengine.qualify.service.CrmSyncResult;
import com.prospect.leadengine.qualify.service.CrmSyncService;
import com.prospect.leadengine.qualify.service.ImportResult;
import com.prospect.leadengine.qualify.service.LeadExportService;
import com.prospect.leadengine.qualify.service.LeadImportService;
import com.prospect.leadengine.qualify.service.LeadQualificationService;
import com.prospect.leadengine.qualify.service.QualificationSummary;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.StringReader;
import java.util.List;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/leads")
public class LeadController {
    private static final int DEFAULT_LIST_LIMIT = 100;

    private final LeadScorer scorer;
    private final LeadQualificationService qualificationService;
    private final LeadImportService importService;
    private final LeadExportService exportService;
    private final CrmSyncService crmSyncService;
    private final LeadRepository leadRepository;
    private final LeadEngineProperties properties;

    public LeadController(
        LeadScorer scorer,
        LeadQualificationService qualificationService,
        LeadImportService importService,
        LeadExportService exportService,
        CrmSyncService crmSyncService,
        LeadRepository leadRepository,
        LeadEngineProperties properties
    ) {
        this.scorer = scorer;
        this.qualificationService = qualificationService;
        this.importService = importService;
        this.exportService = exportService;
        this.crmSyncService = crmSyncService;
        this.leadRepository = leadRepository;
        this.properties = properties;
    }

    @PostMapping("/score")
    public BatchScoringResult score(@RequestBody List<Lead> leads) {
        return scorer.scoreBatch(leads);
    }

    @PostMapping("/qualify")
    public QualificationSummary qualify(@RequestBody QualifyRequest request) {
        boolean enrich = request.enrich() != null && request.enrich();
        return qualificationService.qualify(request.leads(), enrich);
    }

    @PostMapping(value = "/import", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public LeadImportResponse importCsv(
        @RequestBody String csv,
        @RequestParam(name = "source", required = false, defaultValue = "csv_import") String source,
        @RequestParam(name = "enrich", required = false, defaultValue = "false") boolean enrich
    ) {
        ImportResult parsed = importService.parse(new StringReader(csv), source);
        QualificationSummary summary = qualificationService.qualify(parsed.leads(), enrich);
        return new LeadImportResponse(parsed.leads().size(), parsed.errors(), summary);
    }

    @GetMapping
    public List<Lead> list(
        @RequestParam(name = "minScore", required = false, defaultValue = "0") double minScore,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        int safeLimit = limit == null ? DEFAULT_LIST_LIMIT : Math.max(1, limit);
        return leadRepository.findByMinScore(minScore, safeLimit);
    }

    @GetMapping("/{id}")
    public Lead get(@PathVariable("id") long id) {
        return leadRepository.findById(id)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Lead not found: " + id));
    }

    @GetMapping("/{id}/recommendations")
    public List<String> recommendations(@PathVariable("id") long id) {
        return scorer.recommendationsFor(get(id));
    }

    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public String export(
        @RequestParam(name = "minScore", required = false, defaultValue = "0") double minScore
    ) {
        List<Lead> leads = minScore <= 0 ? leadRepository.findAll() : leadRepository.findByMinScore(minScore, Integer.MAX_VALUE);
        return exportService.export(leads);
    }

    @PostMapping("/crm-sync")
    public List<CrmSyncResult> crmSync(@RequestParam(name = "limit", required = false) Integer limit) {
        int safeLimit = limit == null ? DEFAULT_LIST_LIMIT : Math.max(1, limit);
        return crmSyncService.sync(leadRepository.findByMinScore(properties.getCrm().getMinScore(), safeLimit));
    }
}

package com.prospect.leadengine.qualify.service;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.model.Lead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Sends qualified leads to the configured {@link CrmSyncClient}. Leads under the CRM floor are skipped.
 */
@Service
public class CrmSyncService {
    private static final Logger log = LoggerFactory.getLogger(CrmSyncService.class);

    private final ObjectProvider<CrmSyncClient> clientProvider;
    private final LeadEngineProperties properties;

    public CrmSyncService(ObjectProvider<CrmSyncClient> clientProvider, LeadEngineProperties properties) {
        this.clientProvider = clientProvider;
        this.properties = properties;
    }

    public List<CrmSyncResult> sync(List<Lead> leads) {
        if (leads == null || leads.isEmpty()) {
            return List.of();
        }
        double floor = properties.getCrm().getMinScore();
        CrmSyncClient client = clientProvider.getIfAvailable();
        List<CrmSyncResult> results = new ArrayList<>();
        int skipped = 0;
        for (Lead lead : leads) {
            if (lead.score() < floor) {
                skipped++;
                continue;
            }
            results.add(syncOne(client, lead));
        }
        long succeeded = results.stream().filter(CrmSyncResult::success).count();
        log.info("CRM sync finished: {} synced, {} failed, {} below floor {}",
            succeeded, results.size() - succeeded, skipped, floor);
        return results;
    }

    private CrmSyncResult syncOne(CrmSyncClient client, Lead lead) {
        if (client == null) {
            return CrmSyncResult.failed(lead.companyName(), CrmSyncResult.NOT_CONFIGURED);
        }
        try {
            CrmSyncResult result = client.sync(lead);
            return result == null ? CrmSyncResult.failed(lead.companyName(), "empty_response") : result;
        } catch (RuntimeException e) {
            log.warn("CRM sync failed for {}", lead.companyName(), e);
            return CrmSyncResult.failed(lead.companyName(), e.getMessage() == null ? e.toString() : e.getMessage());
        }
    }
}

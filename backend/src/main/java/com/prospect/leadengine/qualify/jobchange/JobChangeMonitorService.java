package com.prospect.leadengine.qualify.jobchange;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.model.DecisionMaker;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.persistence.TrackedContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns all writes to tracked contacts. Poll cycles never overlap; a cycle requested while another runs is skipped.
 */
@Service
public class JobChangeMonitorService {
    private static final Logger log = LoggerFactory.getLogger(JobChangeMonitorService.class);

    private final TrackedContactRepository repository;
    private final ProfileLookupClient profileLookupClient;
    private final OpportunityScorer opportunityScorer;
    private final OpportunityAlertFactory alertFactory;
    private final LeadEngineProperties properties;
    private final ReentrantLock pollLock = new ReentrantLock();

    public JobChangeMonitorService(
        TrackedContactRepository repository,
        ProfileLookupClient profileLookupClient,
        OpportunityScorer opportunityScorer,
        OpportunityAlertFactory alertFactory,
        LeadEngineProperties properties
    ) {
        this.repository = repository;
        this.profileLookupClient = profileLookupClient;
        this.opportunityScorer = opportunityScorer;
        this.alertFactory = alertFactory;
        this.properties = properties;
    }

    /**
     * Starts tracking every decision maker with a profile URL that is not tracked yet. The lead's company, the
     * contact's role and the lead's score become the contact's baseline.
     */
    public int trackContacts(List<Lead> leads) {
        if (leads == null || leads.isEmpty()) {
            return 0;
        }
        int added = 0;
        Instant now = Instant.now();
        for (Lead lead : leads) {
            for (DecisionMaker decisionMaker : lead.decisionMakers()) {
                if (!decisionMaker.hasProfileUrl()) {
                    continue;
                }
                TrackedContact contact = new TrackedContact(
                    null,
                    decisionMaker.name() == null ? decisionMaker.profileUrl() : decisionMaker.name(),
                    decisionMaker.profileUrl().trim(),
                    decisionMaker.email(),
                    decisionMaker.phone(),
                    lead.companyName(),
                    decisionMaker.role(),
                    lead.companyName(),
                    decisionMaker.role(),
                    lead.score(),
                    now,
                    null,
                    ContactStatus.ACTIVE
                );
                if (repository.insertIfAbsent(contact)) {
                    added++;
                }
            }
        }
        log.info("Added {} contacts for job change monitoring", added);
        return added;
    }

    public PollSummary pollOnce() {
        return pollOnce(properties.getJobChange().getPollLimit());
    }

    /**
     * Checks up to {@code limit} due contacts, pacing profile lookups by the configured fetch delay.
     */
    public PollSummary pollOnce(int limit) {
        if (!pollLock.tryLock()) {
            log.info("Job change poll already running, skipping");
            return PollSummary.skipped();
        }
        try {
            return runPoll(limit);
        } finally {
            pollLock.unlock();
        }
    }

    private PollSummary runPoll(int limit) {
        List<TrackedContact> due = repository.findDueForCheck(limit);
        List<JobChangeEvent> changes = new ArrayList<>();
        int checked = 0;
        int noData = 0;
        int failed = 0;
        long delayMs = properties.getJobChange().getFetchDelayMs();
        for (int i = 0; i < due.size(); i++) {
            TrackedContact contact = due.get(i);
            if (i > 0 && !pause(delayMs)) {
                log.warn("Job change poll interrupted after {} of {} contacts", i, due.size());
                break;
            }
            try {
                Optional<ProfileSnapshot> snapshot = profileLookupClient.lookup(contact.profileUrl());
                if (snapshot.isEmpty()) {
                    noData++;
                    log.debug("No profile data for {}", contact.profileUrl());
                    continue;
                }
                checkContact(contact, snapshot.get()).ifPresent(changes::add);
                checked++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Error checking contact {} ({})", contact.name(), contact.profileUrl(), e);
            }
        }
        log.info(
            "Job change poll finished: selected={} checked={} noData={} failed={} changes={}",
            due.size(),
            checked,
            noData,
            failed,
            changes.size()
        );
        return new PollSummary(true, due.size(), checked, noData, failed, changes);
    }

    Optional<JobChangeEvent> checkContact(TrackedContact contact, ProfileSnapshot snapshot) {
        Instant now = Instant.now();
        String newCompany = hasText(snapshot.company()) ? snapshot.company() : contact.currentCompany();
        String newRole = hasText(snapshot.role()) ? snapshot.role() : contact.currentRole();
        Optional<ChangeType> changeType = ChangeType.between(
            contact.currentCompany(),
            snapshot.company(),
            contact.currentRole(),
            snapshot.role()
        );
        if (changeType.isEmpty()) {
            repository.recordCheck(contact.id(), newCompany, newRole, now);
            return Optional.empty();
        }
        double score = opportunityScorer.score(contact.currentCompany(), newCompany, contact.currentRole(), newRole);
        JobChangeEvent stored = repository.recordChange(
            new JobChangeEvent(
                null,
                contact.id(),
                contact.currentCompany(),
                newCompany,
                contact.currentRole(),
                newRole,
                changeType.get(),
                now,
                score,
                AlertStatus.NEW
            ),
            newCompany,
            newRole,
            now
        );
        log.info(
            "Job change detected for {}: {} ({} -> {}), score {}",
            contact.name(),
            changeType.get().value(),
            contact.currentCompany(),
            newCompany,
            score
        );
        return Optional.ofNullable(stored);
    }

    public List<JobChangeView> recentChanges(int days, double minScore) {
        Instant since = Instant.now().minus(Duration.ofDays(Math.max(0, days)));
        return repository.findRecentChanges(since, minScore);
    }

    public List<OpportunityAlert> alerts(int days, double minScore) {
        List<OpportunityAlert> alerts = new ArrayList<>();
        for (JobChangeView view : recentChanges(days, minScore)) {
            alerts.add(alertFactory.create(view));
        }
        return alerts;
    }

    public boolean updateAlertStatus(long eventId, AlertStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("alert status is required");
        }
        return repository.updateAlertStatus(eventId, status);
    }

    public int expireInactiveContacts() {
        return expireInactiveContacts(properties.getJobChange().getInactivityDays());
    }

    public int expireInactiveContacts(int inactivityDays) {
        Instant cutoff = Instant.now().minus(Duration.ofDays(Math.max(1, inactivityDays)));
        int expired = repository.markInactiveNotCheckedSince(cutoff);
        if (expired > 0) {
            log.info("Marked {} tracked contacts inactive (no check since {})", expired, cutoff);
        }
        return expired;
    }

    public int purgeEvents() {
        return purgeEvents(properties.getJobChange().getEventRetentionDays());
    }

    public int purgeEvents(int retentionDays) {
        Instant cutoff = Instant.now().minus(Duration.ofDays(Math.max(1, retentionDays)));
        int deleted = repository.deleteEventsDetectedBefore(cutoff);
        if (deleted > 0) {
            log.info("Deleted {} job change events detected before {}", deleted, cutoff);
        }
        return deleted;
    }

    private boolean pause(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

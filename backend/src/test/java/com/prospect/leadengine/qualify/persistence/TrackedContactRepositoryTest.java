package com.prospect.leadengine.qualify.persistence;

import com.prospect.leadengine.qualify.jobchange.AlertStatus;
import com.prospect.leadengine.qualify.jobchange.ChangeType;
import com.prospect.leadengine.qualify.jobchange.ContactStatus;
import com.prospect.leadengine.qualify.jobchange.JobChangeEvent;
import com.prospect.leadengine.qualify.jobchange.JobChangeView;
import com.prospect.leadengine.qualify.jobchange.TrackedContact;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class TrackedContactRepositoryTest {

    @Autowired
    private TrackedContactRepository repository;
    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void profileUrlIsTrackedOnlyOnce() {
        TrackedContact contact = contact(uniqueUrl(), Instant.now());

        assertThat(repository.insertIfAbsent(contact)).isTrue();
        assertThat(repository.insertIfAbsent(contact)).isFalse();
        assertThat(repository.findByProfileUrl(contact.profileUrl()))
            .get()
            .satisfies(stored -> {
                assertThat(stored.status()).isEqualTo(ContactStatus.ACTIVE);
                assertThat(stored.lastCheckedAt()).isNull();
                assertThat(stored.originalLeadScore()).isEqualTo(71.0);
            });
    }

    @Test
    void neverCheckedContactsComeFirst() {
        String checkedUrl = uniqueUrl();
        String freshUrl = uniqueUrl();
        repository.insertIfAbsent(contact(checkedUrl, Instant.now()));
        repository.insertIfAbsent(contact(freshUrl, Instant.now()));
        long checkedId = repository.findByProfileUrl(checkedUrl).orElseThrow().id();
        repository.recordCheck(checkedId, "Acme Foods", "Engineer", Instant.now().minusSeconds(60));

        List<TrackedContact> due = repository.findDueForCheck(500);

        int freshIndex = indexOf(due, freshUrl);
        int checkedIndex = indexOf(due, checkedUrl);
        assertThat(freshIndex).isNotNegative();
        assertThat(checkedIndex).isGreaterThan(freshIndex);
    }

    @Test
    void recentChangesJoinContactAndFilterByScore() {
        String url = uniqueUrl();
        repository.insertIfAbsent(contact(url, Instant.now()));
        long contactId = repository.findByProfileUrl(url).orElseThrow().id();
        JobChangeEvent strong = repository.insertEvent(event(contactId, 95.0, Instant.now()));
        repository.insertEvent(event(contactId, 55.0, Instant.now()));
        repository.insertEvent(event(contactId, 99.0, Instant.now().minus(Duration.ofDays(40))));

        List<JobChangeView> recent = repository.findRecentChanges(Instant.now().minus(Duration.ofDays(30)), 60.0);

        List<JobChangeView> mine = recent.stream().filter(view -> url.equals(view.profileUrl())).toList();
        assertThat(mine).hasSize(1);
        assertThat(mine.get(0).event().id()).isEqualTo(strong.id());
        assertThat(mine.get(0).originalCompany()).isEqualTo("Acme Foods");
        assertThat(mine.get(0).event().changeType()).isEqualTo(ChangeType.BOTH);

        assertThat(repository.updateAlertStatus(strong.id(), AlertStatus.ACTIONED)).isTrue();
        assertThat(repository.findEventsForContact(contactId))
            .filteredOn(stored -> stored.id().equals(strong.id()))
            .singleElement()
            .extracting(JobChangeEvent::alertStatus)
            .isEqualTo(AlertStatus.ACTIONED);
        assertThat(repository.updateAlertStatus(-1L, AlertStatus.DISMISSED)).isFalse();
    }

    @Test
    void recordedChangeMovesContactWithTheEvent() {
        String url = uniqueUrl();
        repository.insertIfAbsent(contact(url, Instant.now()));
        long contactId = repository.findByProfileUrl(url).orElseThrow().id();

        JobChangeEvent stored = repository.recordChange(event(contactId, 90.0, Instant.now()), "Nimbus Cloud", "CTO", Instant.now());

        assertThat(stored.id()).isNotNull();
        TrackedContact moved = repository.findByProfileUrl(url).orElseThrow();
        assertThat(moved.currentCompany()).isEqualTo("Nimbus Cloud");
        assertThat(moved.currentRole()).isEqualTo("CTO");
        assertThat(moved.lastCheckedAt()).isNotNull();
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void failedContactUpdateLeavesNoEventBehind() {
        String url = uniqueUrl();
        repository.insertIfAbsent(contact(url, Instant.now()));
        long contactId = repository.findByProfileUrl(url).orElseThrow().id();
        String oversizedRole = "x".repeat(600);
        try {
            assertThatThrownBy(() -> repository.recordChange(
                event(contactId, 90.0, Instant.now()),
                "Nimbus Cloud",
                oversizedRole,
                Instant.now()
            )).isInstanceOf(DataAccessException.class);

            assertThat(repository.findEventsForContact(contactId)).isEmpty();
            TrackedContact unchanged = repository.findByProfileUrl(url).orElseThrow();
            assertThat(unchanged.currentCompany()).isEqualTo("Acme Foods");
            assertThat(unchanged.lastCheckedAt()).isNull();
        } finally {
            jdbc.update(
                "DELETE FROM tracked_contacts WHERE profile_url = :profileUrl",
                new MapSqlParameterSource("profileUrl", url)
            );
        }
    }

    @Test
    void staleContactsBecomeInactiveAndOldEventsArePurged() {
        String staleUrl = uniqueUrl();
        String recentUrl = uniqueUrl();
        repository.insertIfAbsent(contact(staleUrl, Instant.now().minus(Duration.ofDays(400))));
        repository.insertIfAbsent(contact(recentUrl, Instant.now().minus(Duration.ofDays(400))));
        long recentId = repository.findByProfileUrl(recentUrl).orElseThrow().id();
        repository.recordCheck(recentId, "Acme Foods", "Engineer", Instant.now().minus(Duration.ofDays(2)));
        repository.insertEvent(event(recentId, 80.0, Instant.now().minus(Duration.ofDays(500))));

        int expired = repository.markInactiveNotCheckedSince(Instant.now().minus(Duration.ofDays(365)));
        int purged = repository.deleteEventsDetectedBefore(Instant.now().minus(Duration.ofDays(365)));

        assertThat(expired).isGreaterThanOrEqualTo(1);
        assertThat(purged).isGreaterThanOrEqualTo(1);
        assertThat(repository.findByProfileUrl(staleUrl).orElseThrow().status()).isEqualTo(ContactStatus.INACTIVE);
        assertThat(repository.findByProfileUrl(recentUrl).orElseThrow().status()).isEqualTo(ContactStatus.ACTIVE);
        assertThat(repository.findEventsForContact(recentId)).isEmpty();
    }

    private int indexOf(List<TrackedContact> contacts, String profileUrl) {
        for (int i = 0; i < contacts.size(); i++) {
            if (profileUrl.equals(contacts.get(i).profileUrl())) {
                return i;
            }
        }
        return -1;
    }

    private String uniqueUrl() {
        return "https://profiles.example/in/" + UUID.randomUUID();
    }

    private TrackedContact contact(String profileUrl, Instant addedAt) {
        return new TrackedContact(
            null,
            "Ana Souza",
            profileUrl,
            "ana@example.com",
            null,
            "Acme Foods",
            "Engineer",
            "Acme Foods",
            "Engineer",
            71.0,
            addedAt,
            null,
            ContactStatus.ACTIVE
        );
    }

    private JobChangeEvent event(long contactId, double score, Instant detectedAt) {
        return new JobChangeEvent(
            null,
            contactId,
            "Acme Foods",
            "Nimbus Cloud",
            "Engineer",
            "CTO",
            ChangeType.BOTH,
            detectedAt,
            score,
            AlertStatus.NEW
        );
    }
}

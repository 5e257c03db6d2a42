package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.qualify.jobchange.AlertStatus;
import com.prospect.leadengine.qualify.jobchange.ChangeType;
import com.prospect.leadengine.qualify.jobchange.ContactStatus;
import com.prospect.leadengine.qualify.jobchange.JobChangeEvent;
import com.prospect.leadengine.qualify.jobchange.TrackedContact;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.Sector;
import com.prospect.leadengine.qualify.persistence.LeadRepository;
import com.prospect.leadengine.qualify.persistence.TrackedContactRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PlaylistServiceTest {

    @Autowired
    private PlaylistService playlistService;

    @Autowired
    private LeadRepository leadRepository;

    @Autowired
    private TrackedContactRepository trackedContactRepository;

    @Test
    void dynamicPlaylistIsPopulatedOnCreateAndFullyReplacedOnRefresh() {
        String marker = marker();
        Lead high = leadRepository.save(lead("High Co", marker, 90.0));
        Lead mid = leadRepository.save(lead("Mid Co", marker, 70.0));
        leadRepository.save(lead("Low Co", marker, 50.0));

        Playlist playlist = playlistService.create(dynamicDraft(marker, 60.0, null));

        assertThat(playlist.id()).isNotNull();
        assertThat(playlist.lastRefreshedAt()).isNotNull();
        assertThat(playlistService.members(playlist.id()))
            .extracting(PlaylistMember::leadId)
            .containsExactly(high.id(), mid.id());

        Lead newcomer = leadRepository.save(lead("New Co", marker, 85.0));
        PlaylistRefreshResult result = playlistService.refresh(playlist.id());

        assertThat(result.refreshed()).isTrue();
        assertThat(result.memberCount()).isEqualTo(3);
        assertThat(playlistService.members(playlist.id()))
            .extracting(PlaylistMember::leadId)
            .containsExactly(high.id(), newcomer.id(), mid.id());
    }

    @Test
    void membershipIsCappedAtTargetSizeWithoutCriteriaLimit() {
        String marker = marker();
        leadRepository.save(lead("One", marker, 91.0));
        leadRepository.save(lead("Two", marker, 81.0));
        leadRepository.save(lead("Three", marker, 71.0));

        Playlist playlist = playlistService.create(dynamicDraft(marker, null, 2));

        assertThat(playlistService.members(playlist.id()))
            .extracting(PlaylistMember::companyName)
            .containsExactly("One", "Two");
    }

    @Test
    void staticPlaylistKeepsHandPickedMembers() {
        String marker = marker();
        Lead first = leadRepository.save(lead("Picked One", marker, 65.0));
        Lead second = leadRepository.save(lead("Picked Two", marker, 45.0));

        Playlist playlist = playlistService.create(new PlaylistDraft(
            "Hand picked " + marker,
            null,
            PlaylistType.STATIC,
            null,
            null,
            null,
            "ana",
            List.of(first.id())
        ));

        assertThat(playlistService.addMembers(playlist.id(), List.of(first.id(), second.id()))).isEqualTo(1);
        PlaylistRefreshResult refresh = playlistService.refresh(playlist.id());
        assertThat(refresh.refreshed()).isFalse();
        assertThat(refresh.memberCount()).isEqualTo(2);
    }

    @Test
    void dynamicMembersCannotBeAddedByHand() {
        Playlist playlist = playlistService.create(dynamicDraft(marker(), null, null));

        assertThatThrownBy(() -> playlistService.addMembers(playlist.id(), List.of(1L)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void performanceTracksContactRate() {
        String marker = marker();
        Lead hot = leadRepository.save(lead("Hot Co", marker, 85.0));
        leadRepository.save(lead("Warm Co", marker, 65.0));
        Playlist playlist = playlistService.create(dynamicDraft(marker, null, null));

        assertThat(playlistService.updateMemberStatus(playlist.id(), hot.id(), MemberStatus.CONTACTED)).isTrue();
        PlaylistPerformance performance = playlistService.performance(playlist.id());

        assertThat(performance.totalLeads()).isEqualTo(2);
        assertThat(performance.averageScore()).isEqualTo(75.0);
        assertThat(performance.hotLeads()).isEqualTo(1);
        assertThat(performance.warmLeads()).isEqualTo(1);
        assertThat(performance.contactedLeads()).isEqualTo(1);
        assertThat(performance.contactRate()).isEqualTo(50.0);
    }

    @Test
    void engagementIsCountedPerActionWithPositiveOutcomes() {
        String marker = marker();
        Lead first = leadRepository.save(lead("Reached Co", marker, 80.0));
        Lead second = leadRepository.save(lead("Called Co", marker, 70.0));
        Lead outsider = leadRepository.save(lead("Outsider Co", marker(), 90.0));
        Playlist playlist = playlistService.create(dynamicDraft(marker, null, null));

        assertThat(playlistService.trackEngagement(playlist.id(), first.id(), "ana", " Email ", "Positive", null))
            .get()
            .satisfies(stored -> {
                assertThat(stored.id()).isNotNull();
                assertThat(stored.actionType()).isEqualTo("email");
                assertThat(stored.outcome()).isEqualTo("positive");
            });
        playlistService.trackEngagement(playlist.id(), second.id(), "ana", "email", "no_reply", null);
        playlistService.trackEngagement(playlist.id(), second.id(), "ana", "call", "positive", "Asked for a proposal");

        PlaylistPerformance performance = playlistService.performance(playlist.id());

        assertThat(performance.engagementByAction()).containsOnlyKeys("call", "email");
        assertThat(performance.engagementByAction().get("email")).isEqualTo(new EngagementStats(2, 1));
        assertThat(performance.engagementByAction().get("call")).isEqualTo(new EngagementStats(1, 1));
        assertThat(playlistService.trackEngagement(playlist.id(), outsider.id(), "ana", "email", null, null)).isEmpty();
        assertThatThrownBy(() -> playlistService.trackEngagement(playlist.id(), first.id(), "ana", " ", null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decisionMakerTemplateFollowsSeniorJobChanges() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        Lead hired = leadRepository.save(Lead.builder("Nimbus " + suffix).score(72.0).build());
        Lead juniorHire = leadRepository.save(Lead.builder("Cirrus " + suffix).score(72.0).build());
        Lead lowScore = leadRepository.save(Lead.builder("Stratus " + suffix).score(40.0).build());
        recordJobChange(hired.companyName(), "Chief Technology Officer");
        recordJobChange(juniorHire.companyName(), "Analyst");
        recordJobChange(lowScore.companyName(), "Head of Data");

        Playlist playlist = playlistService.createFromTemplate("new-decision-makers", "ana");

        assertThat(playlist.criteria().jobChangeWithinDays()).isEqualTo(90);
        assertThat(playlistService.members(playlist.id()))
            .extracting(PlaylistMember::leadId)
            .contains(hired.id())
            .doesNotContain(juniorHire.id(), lowScore.id());
    }

    @Test
    void archivedPlaylistsAreHiddenAndNotRefreshed() {
        Playlist playlist = playlistService.create(dynamicDraft(marker(), null, null));

        Playlist archived = playlistService.archive(playlist.id());

        assertThat(archived.status()).isEqualTo(PlaylistStatus.ARCHIVED);
        assertThat(playlistService.list(false)).extracting(Playlist::id).doesNotContain(playlist.id());
        assertThat(playlistService.list(true)).extracting(Playlist::id).contains(playlist.id());
        assertThat(playlistService.refresh(playlist.id()).refreshed()).isFalse();
        assertThat(playlistService.refreshDue()).extracting(PlaylistRefreshResult::playlistId)
            .doesNotContain(playlist.id());
    }

    @Test
    void templatePlaylistCarriesTemplateCriteria() {
        Playlist playlist = playlistService.createFromTemplate("banking-transformation", "ana");

        assertThat(playlist.criteria().sectors()).containsExactly(Sector.BANKING, Sector.FINTECH);
        assertThat(playlist.type()).isEqualTo(PlaylistType.DYNAMIC);
        assertThatThrownBy(() -> playlistService.createFromTemplate("no-such-template", "ana"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownPlaylistIsReportedAsNotFound() {
        assertThatThrownBy(() -> playlistService.get(-42L)).isInstanceOf(PlaylistNotFoundException.class);
        assertThatThrownBy(() -> playlistService.performance(-42L)).isInstanceOf(PlaylistNotFoundException.class);
    }

    private void recordJobChange(String newCompany, String newRole) {
        String url = "https://profiles.example/in/" + UUID.randomUUID();
        trackedContactRepository.insertIfAbsent(new TrackedContact(
            null,
            "Rita Lima",
            url,
            null,
            null,
            "Old Employer",
            "Engineer",
            "Old Employer",
            "Engineer",
            60.0,
            Instant.now(),
            null,
            ContactStatus.ACTIVE
        ));
        long contactId = trackedContactRepository.findByProfileUrl(url).orElseThrow().id();
        trackedContactRepository.recordChange(
            new JobChangeEvent(
                null,
                contactId,
                "Old Employer",
                newCompany,
                "Engineer",
                newRole,
                ChangeType.BOTH,
                Instant.now(),
                80.0,
                AlertStatus.NEW
            ),
            newCompany,
            newRole,
            Instant.now()
        );
    }

    private PlaylistDraft dynamicDraft(String marker, Double minScore, Integer targetSize) {
        PlaylistCriteria.Builder criteria = PlaylistCriteria.builder().technologyKeywords(marker);
        if (minScore != null) {
            criteria.minScore(minScore);
        }
        return new PlaylistDraft(
            "Playlist " + marker,
            "Leads tagged " + marker,
            PlaylistType.DYNAMIC,
            criteria.build(),
            targetSize,
            24,
            "ana",
            List.of()
        );
    }

    private Lead lead(String company, String marker, double score) {
        return Lead.builder(company)
            .sector(Sector.RETAIL)
            .technologies(List.of(marker, "wordpress"))
            .score(score)
            .build();
    }

    private String marker() {
        return "tag-" + UUID.randomUUID().toString().substring(0, 8);
    }
}

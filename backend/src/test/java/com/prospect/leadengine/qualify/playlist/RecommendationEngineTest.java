package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.model.CloudMaturity;
import com.prospect.leadengine.qualify.model.CompanySize;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.PriorityTier;
import com.prospect.leadengine.qualify.model.Sector;
import com.prospect.leadengine.qualify.persistence.LeadRepository;
import com.prospect.leadengine.qualify.persistence.PlaylistRepository;
import com.prospect.leadengine.qualify.persistence.UserPreferencesRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecommendationEngineTest {

    @Mock
    private LeadRepository leadRepository;
    @Mock
    private PlaylistRepository playlistRepository;
    @Mock
    private UserPreferencesRepository preferencesRepository;

    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RecommendationEngine(
            new PlaylistMatcher(),
            leadRepository,
            playlistRepository,
            preferencesRepository,
            new LeadEngineProperties()
        );
    }

    @Test
    void defaultPreferencesComeFromConfiguration() {
        when(preferencesRepository.find("nobody")).thenReturn(Optional.empty());

        UserPreferences preferences = engine.preferencesFor("nobody");

        assertThat(preferences.preferredSectors()).containsExactly(Sector.BANKING, Sector.TECHNOLOGY, Sector.RETAIL);
        assertThat(preferences.preferredCompanySizes())
            .containsExactly(CompanySize.MEDIUM, CompanySize.LARGE, CompanySize.ENTERPRISE);
        assertThat(preferences.minScore()).isEqualTo(60.0);
        assertThat(preferences.maxLeadsPerDay()).isEqualTo(10);
    }

    @Test
    void templatesAreFilteredAndRankedByConfidenceThenSize() {
        UserPreferences preferences = new UserPreferences(
            "ana",
            List.of(Sector.BANKING, Sector.TECHNOLOGY, Sector.RETAIL),
            List.of(),
            60.0,
            10
        );

        List<PlaylistRecommendation> recommendations = engine.recommendTemplates(preferences, List.of());

        assertThat(recommendations)
            .extracting(recommendation -> recommendation.template().key())
            .containsExactly("banking-transformation", "hot-migration", "scale-up-tech");
        assertThat(recommendations.get(0).confidence()).isCloseTo(1.0, within(1e-9));
        assertThat(recommendations.get(1).confidence()).isCloseTo(0.85, within(1e-9));
        assertThat(recommendations.get(1).estimatedLeads()).isEqualTo(50);
        assertThat(recommendations).allSatisfy(recommendation ->
            assertThat(recommendation.playlistType()).isEqualTo(PlaylistType.DYNAMIC));
    }

    @Test
    void withoutSectorPreferencesOnlyTheScoreFloorFilters() {
        UserPreferences preferences = new UserPreferences("bruno", List.of(), List.of(), 0.0, 5);

        List<PlaylistRecommendation> recommendations = engine.recommendTemplates(preferences, List.of());

        assertThat(recommendations).hasSize(5);
        assertThat(recommendations).allSatisfy(recommendation ->
            assertThat(recommendation.confidence()).isLessThanOrEqualTo(1.0));
    }

    @Test
    void livePoolDrivesSizeEstimate() {
        Lead bank = Lead.builder("Banco Azul")
            .sector(Sector.BANKING)
            .companySize(CompanySize.LARGE)
            .cloudMaturity(CloudMaturity.EXPLORING)
            .score(82.0)
            .build();
        UserPreferences preferences = new UserPreferences("ana", List.of(Sector.BANKING), List.of(), 60.0, 10);

        List<PlaylistRecommendation> recommendations = engine.recommendTemplates(preferences, List.of(bank));

        assertThat(recommendations)
            .filteredOn(recommendation -> recommendation.template().key().equals("banking-transformation"))
            .singleElement()
            .extracting(PlaylistRecommendation::estimatedLeads)
            .isEqualTo(1);
        assertThat(recommendations)
            .filteredOn(recommendation -> recommendation.template().key().equals("hot-migration"))
            .singleElement()
            .extracting(PlaylistRecommendation::estimatedLeads)
            .isEqualTo(0);
    }

    @Test
    void dailyRecommendationsDeduplicateCompaniesAndRespectDailyLimit() {
        when(preferencesRepository.find("ana"))
            .thenReturn(Optional.of(new UserPreferences("ana", List.of(), List.of(), 60.0, 2)));
        when(playlistRepository.findDailyCandidates(4)).thenReturn(List.of(
            candidate(1L, "Acme", 90.0, "Hot"),
            candidate(2L, "ACME ", 88.0, "Banking"),
            candidate(3L, "Beta Retail", 70.0, "Hot"),
            candidate(4L, "Gamma", 65.0, "Hot")
        ));
        when(leadRepository.findByIds(List.of(1L, 2L, 3L, 4L))).thenReturn(List.of(
            lead(1L, "Acme", Sector.BANKING, 90.0),
            lead(2L, "ACME ", Sector.BANKING, 88.0),
            lead(3L, "Beta Retail", Sector.RETAIL, 70.0),
            lead(4L, "Gamma", Sector.OTHER, 65.0)
        ));

        List<DailyLeadRecommendation> daily = engine.dailyRecommendations("ana", 10);

        assertThat(daily).extracting(recommendation -> recommendation.lead().id()).containsExactly(1L, 3L);
        DailyLeadRecommendation first = daily.get(0);
        assertThat(first.sourcePlaylist()).isEqualTo("Hot");
        assertThat(first.priority()).isEqualTo(PriorityTier.HOT);
        assertThat(first.reasoning()).startsWith("Selected from playlist 'Hot'. ");
        assertThat(first.suggestedActions()).hasSize(4).contains("Schedule a discovery meeting");
        assertThat(daily.get(1).suggestedActions()).contains("Send a personalized email");
    }

    private DailyCandidate candidate(long leadId, String company, double score, String playlist) {
        PlaylistMember member = new PlaylistMember(
            leadId * 10,
            leadId % 2,
            leadId,
            company,
            score,
            PriorityTier.fromScore(score),
            Instant.now(),
            MemberStatus.NEW
        );
        return new DailyCandidate(member, playlist);
    }

    private Lead lead(long id, String company, Sector sector, double score) {
        return Lead.builder(company)
            .id(id)
            .sector(sector)
            .website("https://" + id + ".example")
            .score(score)
            .build();
    }
}

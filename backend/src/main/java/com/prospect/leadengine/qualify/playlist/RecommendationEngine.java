package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.model.CompanySize;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.Sector;
import com.prospect.leadengine.qualify.persistence.LeadRepository;
import com.prospect.leadengine.qualify.persistence.PlaylistRepository;
import com.prospect.leadengine.qualify.persistence.UserPreferencesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Offers playlist templates that fit a user's preferences and picks today's leads from active playlists.
 */
@Service
public class RecommendationEngine {
    private static final Logger log = LoggerFactory.getLogger(RecommendationEngine.class);
    static final int MAX_TEMPLATE_RECOMMENDATIONS = 5;
    static final int MAX_SUGGESTED_ACTIONS = 4;
    static final int MAX_REASONS = 3;
    private static final int NO_POOL_ESTIMATE = 100;

    private final PlaylistMatcher matcher;
    private final LeadRepository leadRepository;
    private final PlaylistRepository playlistRepository;
    private final UserPreferencesRepository preferencesRepository;
    private final LeadEngineProperties properties;

    public RecommendationEngine(
        PlaylistMatcher matcher,
        LeadRepository leadRepository,
        PlaylistRepository playlistRepository,
        UserPreferencesRepository preferencesRepository,
        LeadEngineProperties properties
    ) {
        this.matcher = matcher;
        this.leadRepository = leadRepository;
        this.playlistRepository = playlistRepository;
        this.preferencesRepository = preferencesRepository;
        this.properties = properties;
    }

    public UserPreferences preferencesFor(String userId) {
        String id = normalizeUserId(userId);
        return preferencesRepository.find(id).orElseGet(() -> defaultPreferences(id));
    }

    public UserPreferences savePreferences(UserPreferences preferences) {
        UserPreferences normalized = new UserPreferences(
            normalizeUserId(preferences.userId()),
            preferences.preferredSectors(),
            preferences.preferredCompanySizes(),
            preferences.minScore(),
            preferences.maxLeadsPerDay()
        );
        preferencesRepository.save(normalized);
        return normalized;
    }

    public List<PlaylistRecommendation> recommendTemplates(String userId) {
        return recommendTemplates(preferencesFor(userId), leadRepository.findAll());
    }

    /**
     * Templates offered to the given preferences, highest confidence first, then largest estimated size.
     * An empty pool falls back to the selectivity heuristic for the size estimate.
     */
    public List<PlaylistRecommendation> recommendTemplates(UserPreferences preferences, List<Lead> pool) {
        List<PlaylistRecommendation> recommendations = new ArrayList<>();
        for (PlaylistTemplate template : PlaylistTemplateCatalog.templates()) {
            if (!isOffered(template, preferences)) {
                continue;
            }
            recommendations.add(new PlaylistRecommendation(
                template,
                estimateSize(template.criteria(), pool),
                confidence(template, preferences),
                PlaylistType.DYNAMIC
            ));
        }
        recommendations.sort(
            Comparator.comparingDouble(PlaylistRecommendation::confidence)
                .thenComparingInt(PlaylistRecommendation::estimatedLeads)
                .reversed()
        );
        return recommendations.size() > MAX_TEMPLATE_RECOMMENDATIONS
            ? List.copyOf(recommendations.subList(0, MAX_TEMPLATE_RECOMMENDATIONS))
            : List.copyOf(recommendations);
    }

    boolean isOffered(PlaylistTemplate template, UserPreferences preferences) {
        List<Sector> sectors = template.criteria().sectors();
        if (preferences.hasSectorPreferences() && !sectors.isEmpty() && !overlaps(sectors, preferences.preferredSectors())) {
            return false;
        }
        return minScoreOf(template.criteria()) >= preferences.minScore();
    }

    double confidence(PlaylistTemplate template, UserPreferences preferences) {
        double confidence = 0.5;
        if (preferences.hasSectorPreferences() && overlaps(template.criteria().sectors(), preferences.preferredSectors())) {
            confidence += 0.2;
        }
        double templateFloor = template.criteria().minScore() == null ? 50.0 : template.criteria().minScore();
        if (Math.abs(templateFloor - preferences.minScore()) <= 10.0) {
            confidence += 0.15;
        }
        String description = template.description() == null ? "" : template.description().toLowerCase(Locale.ROOT);
        for (String keyword : properties.getRecommendations().getSpecializationKeywords()) {
            if (keyword != null && !keyword.isBlank() && description.contains(keyword.toLowerCase(Locale.ROOT))) {
                confidence += 0.15;
                break;
            }
        }
        return Math.min(confidence, 1.0);
    }

    int estimateSize(PlaylistCriteria criteria, List<Lead> pool) {
        if (pool != null && !pool.isEmpty()) {
            return matcher.match(pool, criteria).size();
        }
        double estimate = NO_POOL_ESTIMATE;
        double minScore = minScoreOf(criteria);
        if (minScore > 80) {
            estimate *= 0.3;
        } else if (minScore > 70) {
            estimate *= 0.5;
        } else if (minScore > 60) {
            estimate *= 0.7;
        }
        int sectorCount = criteria.sectors().size();
        if (sectorCount == 1) {
            estimate *= 0.6;
        } else if (sectorCount == 2) {
            estimate *= 0.8;
        }
        return (int) estimate;
    }

    /**
     * Today's leads for a user: fresh members of active playlists, best first, one per company.
     */
    public List<DailyLeadRecommendation> dailyRecommendations(String userId, int limit) {
        UserPreferences preferences = preferencesFor(userId);
        int dailyLimit = Math.max(1, Math.min(limit, preferences.maxLeadsPerDay()));
        List<DailyCandidate> candidates = playlistRepository.findDailyCandidates(dailyLimit * 2);
        Map<Long, Lead> leads = leadRepository.findByIds(
                candidates.stream().map(candidate -> candidate.member().leadId()).distinct().toList()
            )
            .stream()
            .collect(Collectors.toMap(Lead::id, Function.identity()));

        Instant now = Instant.now();
        Set<String> seenCompanies = new HashSet<>();
        List<DailyLeadRecommendation> recommendations = new ArrayList<>();
        for (DailyCandidate candidate : candidates) {
            if (recommendations.size() >= dailyLimit) {
                break;
            }
            Lead lead = leads.get(candidate.member().leadId());
            if (lead == null) {
                continue;
            }
            String companyKey = lead.companyName() == null ? "" : lead.companyName().trim().toLowerCase(Locale.ROOT);
            if (!seenCompanies.add(companyKey)) {
                continue;
            }
            recommendations.add(new DailyLeadRecommendation(
                lead,
                candidate.member().score(),
                candidate.member().priority(),
                candidate.playlistName(),
                reasoning(lead, candidate.member().score(), candidate.playlistName()),
                suggestedActions(lead, candidate.member().score()),
                now
            ));
        }
        log.debug("Prepared {} daily recommendations for {}", recommendations.size(), preferences.userId());
        return recommendations;
    }

    String reasoning(Lead lead, double score, String playlistName) {
        List<String> reasons = new ArrayList<>();
        if (score >= 80) {
            reasons.add("Very high score, an extremely well qualified prospect");
        } else if (score >= 70) {
            reasons.add("High score, an excellent opportunity");
        } else if (score >= 60) {
            reasons.add("Good score, worth approaching");
        }
        if (lead.sector() == Sector.BANKING) {
            reasons.add("Banking is a priority sector");
        } else if (lead.sector() == Sector.TECHNOLOGY) {
            reasons.add("Tech company that understands the value of cloud");
        } else if (lead.sector() == Sector.RETAIL) {
            reasons.add("Retail needs to scale for demand peaks");
        }
        if (lead.usesTargetCloud()) {
            reasons.add("Already on AWS, an expansion opportunity");
        } else if (lead.competitorCloud() != null && !lead.competitorCloud().isBlank()) {
            reasons.add("Runs on a competing cloud, a potential migration");
        } else {
            reasons.add("No cloud yet, a first-migration opportunity");
        }
        List<String> top = reasons.size() > MAX_REASONS ? reasons.subList(0, MAX_REASONS) : reasons;
        return "Selected from playlist '" + playlistName + "'. " + String.join(". ", top);
    }

    List<String> suggestedActions(Lead lead, double score) {
        List<String> actions = new ArrayList<>();
        actions.add("Research decision-maker contacts");
        if (lead.hasWebsite()) {
            actions.add("Review the company website");
        }
        if (score >= 80) {
            actions.add("Schedule a discovery meeting");
            actions.add("Prepare a similar customer case");
        } else if (score >= 70) {
            actions.add("Send a personalized email");
            actions.add("Prepare an initial proposal");
        } else {
            actions.add("Nurture with relevant content");
        }
        if (lead.sector() == Sector.BANKING) {
            actions.add("Emphasize compliance and security");
        } else if (lead.sector() == Sector.RETAIL) {
            actions.add("Highlight scalability for demand peaks");
        }
        return actions.size() > MAX_SUGGESTED_ACTIONS ? List.copyOf(actions.subList(0, MAX_SUGGESTED_ACTIONS)) : actions;
    }

    private UserPreferences defaultPreferences(String userId) {
        LeadEngineProperties.Recommendations defaults = properties.getRecommendations();
        List<Sector> sectors = new ArrayList<>();
        for (String raw : defaults.getDefaultPreferredSectors()) {
            Sector sector = Sector.fromValue(raw);
            if (sector != null) {
                sectors.add(sector);
            }
        }
        List<CompanySize> sizes = new ArrayList<>();
        for (String raw : defaults.getDefaultPreferredCompanySizes()) {
            CompanySize size = CompanySize.fromValue(raw);
            if (size != null) {
                sizes.add(size);
            }
        }
        return new UserPreferences(
            userId,
            sectors,
            sizes,
            defaults.getDefaultMinScore(),
            defaults.getDefaultMaxLeadsPerDay()
        );
    }

    private double minScoreOf(PlaylistCriteria criteria) {
        return criteria.minScore() == null ? 0.0 : criteria.minScore();
    }

    private boolean overlaps(List<Sector> left, List<Sector> right) {
        for (Sector sector : left) {
            if (right.contains(sector)) {
                return true;
            }
        }
        return false;
    }

    private String normalizeUserId(String userId) {
        return userId == null || userId.isBlank() ? "default" : userId.trim();
    }
}

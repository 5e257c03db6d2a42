package com.prospect.leadengine.qualify.scoring;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.model.CloudMaturity;
import com.prospect.leadengine.qualify.model.CompanySize;
import com.prospect.leadengine.qualify.model.InvalidLeadException;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.Sector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class LeadScorer {
    private static final Logger log = LoggerFactory.getLogger(LeadScorer.class);
    private static final int MAX_RECOMMENDATIONS = 5;
    private static final List<String> NOTE_TECH_KEYWORDS = List.of(
        "digital", "tech", "software", "cloud", "data",
        "analytics", "ai", "ml", "automation", "devops"
    );
    private static final List<String> TARGET_SERVICE_KEYWORDS = List.of(
        "ec2", "s3", "rds", "lambda", "cloudfront", "elastic",
        "dynamodb", "redshift", "sagemaker", "ecs", "eks",
        "fargate", "aurora", "cloudwatch", "route53"
    );
    private static final List<String> SOLVABLE_PAIN_KEYWORDS = List.of(
        "scalability", "performance", "cost", "reliability",
        "security", "compliance", "infrastructure", "deployment",
        "monitoring", "backup", "disaster recovery"
    );
    private static final Map<String, Integer> COMPETITOR_SCORES = Map.ofEntries(
        Map.entry("azure", 80),
        Map.entry("gcp", 80),
        Map.entry("google cloud", 80),
        Map.entry("ibm", 70),
        Map.entry("ibm cloud", 70),
        Map.entry("oracle", 70),
        Map.entry("oracle cloud", 70),
        Map.entry("alibaba", 60),
        Map.entry("alibaba cloud", 60),
        Map.entry("other", 50)
    );
    private static final int UNKNOWN_COMPETITOR_SCORE = 50;
    private static final int UNKNOWN_SECTOR_SCORE = 40;
    private static final Map<Sector, List<String>> SECTOR_RECOMMENDATIONS = Map.of(
        Sector.BANKING, List.of("Compliance and security assessment", "High-availability architecture"),
        Sector.RETAIL, List.of("Scalable e-commerce infrastructure", "CDN and performance optimization"),
        Sector.HEALTHCARE, List.of("Health-data compliance setup", "Secure data storage solutions"),
        Sector.MANUFACTURING, List.of("IoT and data analytics platform", "Supply chain optimization")
    );

    private final ScoringWeights weights;

    @Autowired
    public LeadScorer(LeadEngineProperties properties) {
        this(ScoringWeights.from(properties.getScoring().getWeights()));
    }

    public LeadScorer(ScoringWeights weights) {
        this.weights = weights == null ? ScoringWeights.DEFAULT : weights;
    }

    public ScoringWeights weights() {
        return weights;
    }

    /**
     * Scores one lead. Throws {@link InvalidLeadException} for a lead that cannot be scored.
     */
    public Lead score(Lead lead) {
        if (lead == null) {
            throw new InvalidLeadException("lead is null");
        }
        if (lead.companyName() == null || lead.companyName().isBlank()) {
            throw new InvalidLeadException("company name is required");
        }
        Map<ScoreFactor, Double> factors = new EnumMap<>(ScoreFactor.class);
        factors.put(ScoreFactor.COMPANY_SIZE, scoreCompanySize(lead));
        factors.put(ScoreFactor.DIGITAL_MATURITY, scoreDigitalMaturity(lead));
        factors.put(ScoreFactor.CLOUD_USAGE, scoreCloudUsage(lead));
        factors.put(ScoreFactor.SECTOR_FIT, scoreSectorFit(lead));

        double total = 0.0;
        Map<String, Double> details = new LinkedHashMap<>();
        for (Map.Entry<ScoreFactor, Double> entry : factors.entrySet()) {
            total += entry.getValue() * weights.weightOf(entry.getKey());
            details.put(entry.getKey().key(), entry.getValue());
        }
        return lead.withScore(round2(total), details);
    }

    public ScoringResult tryScore(Lead lead) {
        try {
            return ScoringResult.success(score(lead));
        } catch (RuntimeException e) {
            Lead fallback = lead == null ? null : lead.withScore(0.0, Map.of());
            return ScoringResult.failure(fallback, e.getMessage());
        }
    }

    public BatchScoringResult scoreBatch(List<Lead> leads) {
        if (leads == null || leads.isEmpty()) {
            return new BatchScoringResult(List.of(), List.of());
        }
        List<Lead> scored = new ArrayList<>(leads.size());
        List<BatchScoringResult.ScoringFailure> failures = new ArrayList<>();
        for (int i = 0; i < leads.size(); i++) {
            Lead lead = leads.get(i);
            ScoringResult result = tryScore(lead);
            if (result.isSuccessful()) {
                log.debug("Scored {}: {} ({})", lead.companyName(), result.lead().score(), result.lead().priority());
            } else {
                String name = lead == null ? null : lead.companyName();
                log.warn("Failed to score lead #{} ({}): {}", i, name, result.error());
                failures.add(new BatchScoringResult.ScoringFailure(i, name, result.error()));
            }
            scored.add(result.lead() == null ? Lead.builder(null).build() : result.lead());
        }
        // List.sort is stable, so equal scores keep their input order.
        scored.sort(Comparator.comparingDouble(Lead::score).reversed());
        log.info("Scored batch of {} leads, {} failures", scored.size(), failures.size());
        return new BatchScoringResult(List.copyOf(scored), List.copyOf(failures));
    }

    double scoreCompanySize(Lead lead) {
        CompanySize size = lead.companySize();
        return size == null ? CompanySize.UNKNOWN_SCORE : size.score();
    }

    double scoreDigitalMaturity(Lead lead) {
        double score = 0;
        if (lead.hasWebsite()) {
            score += 20;
        }
        int distinctTechnologies = distinctTechnologies(lead).size();
        if (distinctTechnologies > 0) {
            score += Math.min(distinctTechnologies * 10, 40);
        }
        // The maturity stage is a floor, not a bonus.
        CloudMaturity maturity = lead.cloudMaturity();
        if (maturity != null) {
            score = Math.max(score, maturity.score());
        }
        if (lead.notes() != null && !lead.notes().isBlank()) {
            String notes = lead.notes().toLowerCase(Locale.ROOT);
            for (String keyword : NOTE_TECH_KEYWORDS) {
                if (notes.contains(keyword)) {
                    score += 5;
                    if (score >= 100) {
                        break;
                    }
                }
            }
        }
        return clamp(score);
    }

    double scoreCloudUsage(Lead lead) {
        double score = 0;
        if (lead.usesTargetCloud()) {
            score = 100;
        } else if (lead.competitorCloud() != null && !lead.competitorCloud().isBlank()) {
            String competitor = lead.competitorCloud().trim().toLowerCase(Locale.ROOT);
            score = COMPETITOR_SCORES.getOrDefault(competitor, UNKNOWN_COMPETITOR_SCORE);
        } else if (!lead.technologies().isEmpty()) {
            long services = lead.technologies().stream()
                .map(tech -> tech.toLowerCase(Locale.ROOT))
                .filter(tech -> TARGET_SERVICE_KEYWORDS.stream().anyMatch(tech::contains))
                .count();
            score = Math.min(services * 20, 80);
        }

        if (!lead.painPoints().isEmpty()) {
            long solvable = lead.painPoints().stream()
                .map(pain -> pain.toLowerCase(Locale.ROOT))
                .filter(pain -> SOLVABLE_PAIN_KEYWORDS.stream().anyMatch(pain::contains))
                .count();
            score = Math.max(score, Math.min(solvable * 10, 70));
        }
        return score;
    }

    double scoreSectorFit(Lead lead) {
        Sector sector = lead.sector();
        if (sector == null) {
            return UNKNOWN_SECTOR_SCORE;
        }
        if (!sector.isTarget()) {
            return UNKNOWN_SECTOR_SCORE;
        }
        return sector.fitScore() > 0 ? sector.fitScore() : Sector.TARGET_DEFAULT_FIT;
    }

    /**
     * Advisory talking points for a lead, in precedence order size, maturity, competitor, sector; at most five.
     */
    public List<String> recommendationsFor(Lead lead) {
        List<String> recommendations = new ArrayList<>();
        if (lead == null) {
            return recommendations;
        }
        if (lead.companySize() != null && lead.companySize().isLargeAccount()) {
            recommendations.add("Enterprise-grade cloud solutions with a dedicated support track");
            recommendations.add("Cost optimization assessment for large-scale infrastructure");
        }
        CloudMaturity maturity = lead.cloudMaturity();
        if (maturity == CloudMaturity.NONE) {
            recommendations.add("Cloud readiness assessment and migration planning");
        } else if (maturity == CloudMaturity.EXPLORING) {
            recommendations.add("Proof of concept for key workloads");
        } else if (maturity == CloudMaturity.ADOPTING || maturity == CloudMaturity.MATURE) {
            recommendations.add("Well-Architected review");
            recommendations.add("Advanced services adoption (AI/ML, analytics)");
        }
        if (lead.competitorCloud() != null && !lead.competitorCloud().isBlank()) {
            recommendations.add("Migration assessment from " + lead.competitorCloud() + " to AWS");
            recommendations.add("TCO comparison and migration roadmap");
        }
        if (lead.sector() != null) {
            recommendations.addAll(SECTOR_RECOMMENDATIONS.getOrDefault(lead.sector(), List.of()));
        }
        return recommendations.size() > MAX_RECOMMENDATIONS
            ? List.copyOf(recommendations.subList(0, MAX_RECOMMENDATIONS))
            : List.copyOf(recommendations);
    }

    private Set<String> distinctTechnologies(Lead lead) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String tech : lead.technologies()) {
            if (!tech.isBlank()) {
                distinct.add(tech.trim().toLowerCase(Locale.ROOT));
            }
        }
        return distinct;
    }

    private double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }

    private double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

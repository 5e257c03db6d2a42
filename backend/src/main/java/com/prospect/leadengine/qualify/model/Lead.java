package com.prospect.leadengine.qualify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A prospective company under qualification.
 *
 * <p>{@code score} is always the weighted combination of {@code scoreDetails}; the priority tier is derived from
 * the score on every read and never stored.
 */
public record Lead(
    Long id,
    String companyName,
    String taxId,
    String website,
    String email,
    String phone,
    String address,
    String city,
    String region,
    Sector sector,
    CompanySize companySize,
    Integer employeeCount,
    Double annualRevenue,
    String profileUrl,
    List<DecisionMaker> decisionMakers,
    List<String> technologies,
    CloudMaturity cloudMaturity,
    boolean usesTargetCloud,
    String competitorCloud,
    List<String> painPoints,
    TechnographicSummary technographics,
    double score,
    Map<String, Double> scoreDetails,
    String notes,
    String source,
    Instant extractedAt,
    Instant updatedAt
) {
    public Lead {
        decisionMakers = copyList(decisionMakers);
        technologies = copyList(technologies);
        painPoints = copyList(painPoints);
        scoreDetails = scoreDetails == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(scoreDetails));
    }

    @JsonProperty(value = "priority", access = JsonProperty.Access.READ_ONLY)
    public PriorityTier priority() {
        return PriorityTier.fromScore(score);
    }

    public boolean hasWebsite() {
        return website != null && !website.isBlank();
    }

    public Lead withId(Long newId) {
        return toBuilder().id(newId).build();
    }

    public Lead withScore(double newScore, Map<String, Double> newScoreDetails) {
        return toBuilder()
            .score(newScore)
            .scoreDetails(newScoreDetails)
            .updatedAt(Instant.now())
            .build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .companyName(companyName)
            .taxId(taxId)
            .website(website)
            .email(email)
            .phone(phone)
            .address(address)
            .city(city)
            .region(region)
            .sector(sector)
            .companySize(companySize)
            .employeeCount(employeeCount)
            .annualRevenue(annualRevenue)
            .profileUrl(profileUrl)
            .decisionMakers(decisionMakers)
            .technologies(technologies)
            .cloudMaturity(cloudMaturity)
            .usesTargetCloud(usesTargetCloud)
            .competitorCloud(competitorCloud)
            .painPoints(painPoints)
            .technographics(technographics)
            .score(score)
            .scoreDetails(scoreDetails)
            .notes(notes)
            .source(source)
            .extractedAt(extractedAt)
            .updatedAt(updatedAt);
    }

    public static Builder builder(String companyName) {
        Instant now = Instant.now();
        return new Builder().companyName(companyName).extractedAt(now).updatedAt(now);
    }

    private static <T> List<T> copyList(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(values.size());
        for (T value : values) {
            if (value != null) {
                copy.add(value);
            }
        }
        return Collections.unmodifiableList(copy);
    }

    public static final class Builder {
        private Long id;
        private String companyName;
        private String taxId;
        private String website;
        private String email;
        private String phone;
        private String address;
        private String city;
        private String region;
        private Sector sector;
        private CompanySize companySize;
        private Integer employeeCount;
        private Double annualRevenue;
        private String profileUrl;
        private List<DecisionMaker> decisionMakers = List.of();
        private List<String> technologies = List.of();
        private CloudMaturity cloudMaturity;
        private boolean usesTargetCloud;
        private String competitorCloud;
        private List<String> painPoints = List.of();
        private TechnographicSummary technographics;
        private double score;
        private Map<String, Double> scoreDetails = Map.of();
        private String notes;
        private String source;
        private Instant extractedAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder companyName(String companyName) {
            this.companyName = companyName;
            return this;
        }

        public Builder taxId(String taxId) {
            this.taxId = taxId;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder sector(Sector sector) {
            this.sector = sector;
            return this;
        }

        public Builder companySize(CompanySize companySize) {
            this.companySize = companySize;
            return this;
        }

        public Builder employeeCount(Integer employeeCount) {
            this.employeeCount = employeeCount;
            return this;
        }

        public Builder annualRevenue(Double annualRevenue) {
            this.annualRevenue = annualRevenue;
            return this;
        }

        public Builder profileUrl(String profileUrl) {
            this.profileUrl = profileUrl;
            return this;
        }

        public Builder decisionMakers(List<DecisionMaker> decisionMakers) {
            this.decisionMakers = decisionMakers;
            return this;
        }

        public Builder technologies(List<String> technologies) {
            this.technologies = technologies;
            return this;
        }

        public Builder cloudMaturity(CloudMaturity cloudMaturity) {
            this.cloudMaturity = cloudMaturity;
            return this;
        }

        public Builder usesTargetCloud(boolean usesTargetCloud) {
            this.usesTargetCloud = usesTargetCloud;
            return this;
        }

        public Builder competitorCloud(String competitorCloud) {
            this.competitorCloud = competitorCloud;
            return this;
        }

        public Builder painPoints(List<String> painPoints) {
            this.painPoints = painPoints;
            return this;
        }

        public Builder technographics(TechnographicSummary technographics) {
            this.technographics = technographics;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder scoreDetails(Map<String, Double> scoreDetails) {
            this.scoreDetails = scoreDetails;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder extractedAt(Instant extractedAt) {
            this.extractedAt = extractedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Lead build() {
            return new Lead(
                id,
                companyName,
                taxId,
                website,
                email,
                phone,
                address,
                city,
                region,
                sector,
                companySize,
                employeeCount,
                annualRevenue,
                profileUrl,
                decisionMakers,
                technologies,
                cloudMaturity,
                usesTargetCloud,
                competitorCloud,
                painPoints,
                technographics,
                score,
                scoreDetails,
                notes,
                source,
                extractedAt,
                updatedAt
            );
        }
    }
}

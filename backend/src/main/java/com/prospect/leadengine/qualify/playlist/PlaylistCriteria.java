package com.prospect.leadengine.qualify.playlist;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.prospect.leadengine.qualify.model.CloudMaturity;
import com.prospect.leadengine.qualify.model.CompanySize;
import com.prospect.leadengine.qualify.model.Sector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Sparse lead filter. Every present field must hold for a lead to match; null or empty fields impose no
 * constraint. Keyword lists match when any keyword is a substring of the lead's joined values.
 * <p>
 * {@code jobChangeWithinDays} keeps leads whose company a tracked contact moved to within that many days;
 * with {@code seniorJobChangesOnly} the contact must have landed a senior role there.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PlaylistCriteria(
    Double minScore,
    List<Sector> sectors,
    List<CompanySize> companySizes,
    List<CloudMaturity> cloudMaturities,
    List<String> competitorClouds,
    Boolean hasWebsite,
    List<String> technologyKeywords,
    List<String> painPointKeywords,
    Integer jobChangeWithinDays,
    Boolean seniorJobChangesOnly,
    Integer limit
) {
    public PlaylistCriteria {
        sectors = compact(sectors);
        companySizes = compact(companySizes);
        cloudMaturities = compact(cloudMaturities);
        competitorClouds = compactText(competitorClouds);
        technologyKeywords = compactText(technologyKeywords);
        painPointKeywords = compactText(painPointKeywords);
        if (jobChangeWithinDays != null && jobChangeWithinDays <= 0) {
            jobChangeWithinDays = null;
        }
        if (limit != null && limit <= 0) {
            limit = null;
        }
    }

    public static PlaylistCriteria any() {
        return builder().build();
    }

    @JsonIgnore
    public boolean isUnconstrained() {
        return minScore == null
            && sectors.isEmpty()
            && companySizes.isEmpty()
            && cloudMaturities.isEmpty()
            && competitorClouds.isEmpty()
            && !Boolean.TRUE.equals(hasWebsite)
            && technologyKeywords.isEmpty()
            && painPointKeywords.isEmpty()
            && jobChangeWithinDays == null;
    }

    @JsonIgnore
    public boolean requiresJobChanges() {
        return jobChangeWithinDays != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static <T> List<T> compact(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>();
        for (T value : values) {
            if (value != null && !copy.contains(value)) {
                copy.add(value);
            }
        }
        return Collections.unmodifiableList(copy);
    }

    private static List<String> compactText(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<String> copy = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                copy.add(value.trim());
            }
        }
        return Collections.unmodifiableList(copy);
    }

    public static final class Builder {
        private Double minScore;
        private List<Sector> sectors;
        private List<CompanySize> companySizes;
        private List<CloudMaturity> cloudMaturities;
        private List<String> competitorClouds;
        private Boolean hasWebsite;
        private List<String> technologyKeywords;
        private List<String> painPointKeywords;
        private Integer jobChangeWithinDays;
        private Boolean seniorJobChangesOnly;
        private Integer limit;

        private Builder() {
        }

        public Builder minScore(double minScore) {
            this.minScore = minScore;
            return this;
        }

        public Builder sectors(Sector... sectors) {
            this.sectors = Arrays.asList(sectors);
            return this;
        }

        public Builder companySizes(CompanySize... companySizes) {
            this.companySizes = Arrays.asList(companySizes);
            return this;
        }

        public Builder cloudMaturities(CloudMaturity... cloudMaturities) {
            this.cloudMaturities = Arrays.asList(cloudMaturities);
            return this;
        }

        public Builder competitorClouds(String... competitorClouds) {
            this.competitorClouds = Arrays.asList(competitorClouds);
            return this;
        }

        public Builder hasWebsite(boolean hasWebsite) {
            this.hasWebsite = hasWebsite;
            return this;
        }

        public Builder technologyKeywords(String... keywords) {
            this.technologyKeywords = Arrays.asList(keywords);
            return this;
        }

        public Builder painPointKeywords(String... keywords) {
            this.painPointKeywords = Arrays.asList(keywords);
            return this;
        }

        public Builder jobChangeWithinDays(int days) {
            this.jobChangeWithinDays = days;
            return this;
        }

        public Builder seniorJobChangesOnly(boolean seniorOnly) {
            this.seniorJobChangesOnly = seniorOnly;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public PlaylistCriteria build() {
            return new PlaylistCriteria(
                minScore,
                sectors,
                companySizes,
                cloudMaturities,
                competitorClouds,
                hasWebsite,
                technologyKeywords,
                painPointKeywords,
                jobChangeWithinDays,
                seniorJobChangesOnly,
                limit
            );
        }
    }
}

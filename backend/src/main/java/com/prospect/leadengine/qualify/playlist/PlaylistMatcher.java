package com.prospect.leadengine.qualify.playlist;

import com.prospect.leadengine.qualify.model.Lead;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class PlaylistMatcher {

    public boolean matches(Lead lead, PlaylistCriteria criteria) {
        return matches(lead, criteria, Set.of());
    }

    /**
     * @param jobChangeCompanies companies tracked contacts recently moved to, as {@link #companyKey} values;
     *     only consulted by criteria that require job changes
     */
    public boolean matches(Lead lead, PlaylistCriteria criteria, Set<String> jobChangeCompanies) {
        if (lead == null) {
            return false;
        }
        if (criteria == null) {
            return true;
        }
        if (criteria.minScore() != null && lead.score() < criteria.minScore()) {
            return false;
        }
        if (!criteria.sectors().isEmpty() && !criteria.sectors().contains(lead.sector())) {
            return false;
        }
        if (!criteria.companySizes().isEmpty() && !criteria.companySizes().contains(lead.companySize())) {
            return false;
        }
        if (!criteria.cloudMaturities().isEmpty() && !criteria.cloudMaturities().contains(lead.cloudMaturity())) {
            return false;
        }
        if (!criteria.competitorClouds().isEmpty() && !competitorMatches(lead.competitorCloud(), criteria.competitorClouds())) {
            return false;
        }
        if (Boolean.TRUE.equals(criteria.hasWebsite()) && !lead.hasWebsite()) {
            return false;
        }
        if (!criteria.technologyKeywords().isEmpty()
            && !anyKeywordIn(String.join(" ", lead.technologies()), criteria.technologyKeywords())) {
            return false;
        }
        if (!criteria.painPointKeywords().isEmpty()
            && !anyKeywordIn(String.join(" ", lead.painPoints()), criteria.painPointKeywords())) {
            return false;
        }
        if (criteria.requiresJobChanges()
            && (jobChangeCompanies == null || !jobChangeCompanies.contains(companyKey(lead.companyName())))) {
            return false;
        }
        return true;
    }

    /**
     * Matching leads, best score first (input order among equal scores), truncated to the criteria limit.
     */
    public List<Lead> match(List<Lead> pool, PlaylistCriteria criteria) {
        return match(pool, criteria, Set.of());
    }

    public List<Lead> match(List<Lead> pool, PlaylistCriteria criteria, Set<String> jobChangeCompanies) {
        if (pool == null || pool.isEmpty()) {
            return List.of();
        }
        List<Lead> matched = new ArrayList<>();
        for (Lead lead : pool) {
            if (matches(lead, criteria, jobChangeCompanies)) {
                matched.add(lead);
            }
        }
        matched.sort(Comparator.comparingDouble(Lead::score).reversed());
        Integer limit = criteria == null ? null : criteria.limit();
        if (limit != null && matched.size() > limit) {
            return List.copyOf(matched.subList(0, limit));
        }
        return List.copyOf(matched);
    }

    /**
     * Case- and whitespace-insensitive key used to line up a lead's company with a job change's new employer.
     */
    public static String companyKey(String companyName) {
        return companyName == null ? "" : companyName.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private boolean competitorMatches(String competitor, List<String> allowed) {
        if (competitor == null || competitor.isBlank()) {
            return false;
        }
        String normalized = competitor.trim().toLowerCase(Locale.ROOT);
        for (String candidate : allowed) {
            if (candidate.toLowerCase(Locale.ROOT).equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    private boolean anyKeywordIn(String text, List<String> keywords) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}

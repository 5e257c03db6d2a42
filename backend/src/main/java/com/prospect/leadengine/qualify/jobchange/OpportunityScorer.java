package com.prospect.leadengine.qualify.jobchange;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores how good a moment a job change is for outreach.
 */
@Component
public class OpportunityScorer {
    static final double BASE_SCORE = 50.0;
    static final double COMPANY_CHANGE_BONUS = 20.0;
    static final double PROMOTION_BONUS = 30.0;
    static final double STILL_SENIOR_BONUS = 15.0;
    static final double TARGET_EMPLOYER_BONUS = 10.0;
    static final double RECENCY_BONUS = 10.0;
    static final double MAX_SCORE = 100.0;

    private static final List<String> SENIOR_TITLE_KEYWORDS = List.of(
        "diretor", "director", "head", "vp", "vice", "chief", "ceo", "cto", "cio"
    );
    private static final List<String> TARGET_EMPLOYER_KEYWORDS = List.of(
        "tecnologia", "tech", "cloud", "aws", "digital", "software"
    );

    /**
     * @param newCompany the company after the change; equal to {@code previousCompany} for a role-only change
     * @param newRole the role after the change; equal to {@code previousRole} for a company-only change
     */
    public double score(String previousCompany, String newCompany, String previousRole, String newRole) {
        double score = BASE_SCORE;
        if (!Objects.equals(previousCompany, newCompany)) {
            score += COMPANY_CHANGE_BONUS;
        }
        if (newRole != null && previousRole != null) {
            boolean wasSenior = isSeniorTitle(previousRole);
            boolean isSenior = isSeniorTitle(newRole);
            if (isSenior && !wasSenior) {
                score += PROMOTION_BONUS;
            } else if (isSenior) {
                score += STILL_SENIOR_BONUS;
            }
        }
        if (newCompany != null && containsAny(newCompany, TARGET_EMPLOYER_KEYWORDS)) {
            score += TARGET_EMPLOYER_BONUS;
        }
        score += RECENCY_BONUS;
        return Math.min(score, MAX_SCORE);
    }

    public boolean isSeniorTitle(String role) {
        return role != null && containsAny(role, SENIOR_TITLE_KEYWORDS);
    }

    private boolean containsAny(String text, List<String> keywords) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}

package com.prospect.leadengine.qualify.techno;

import com.prospect.leadengine.qualify.model.CloudMaturity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link TechnologyProfile} into a cloud-maturity stage, migration opportunities and intent signals.
 * Stateless.
 */
@Component
public class TechnographicClassifier {
    static final int NATIVE_SERVICE_COUNT = 5;
    static final int MATURE_SERVICE_COUNT = 2;
    static final int EXPLORING_INDICATOR_COUNT = 2;
    static final int CDN_OPPORTUNITY_MIN_TECH = 3;

    public CloudMaturity maturity(TechnologyProfile profile) {
        if (profile == null || profile.isEmpty()) {
            return CloudMaturity.NONE;
        }
        if (profile.hasTargetProvider()) {
            int services = profile.targetCloudServices().size();
            if (services >= NATIVE_SERVICE_COUNT) {
                return CloudMaturity.NATIVE;
            }
            if (services >= MATURE_SERVICE_COUNT) {
                return CloudMaturity.MATURE;
            }
            return CloudMaturity.ADOPTING;
        }
        if (profile.hasCloudProvider()) {
            return CloudMaturity.ADOPTING;
        }
        int readiness = 0;
        if (profile.has(TechCategory.CDN)) {
            readiness++;
        }
        if (profile.has(TechCategory.ANALYTICS)) {
            readiness++;
        }
        if (profile.hasModernFrontend()) {
            readiness++;
        }
        return readiness >= EXPLORING_INDICATOR_COUNT ? CloudMaturity.EXPLORING : CloudMaturity.NONE;
    }

    public List<MigrationOpportunity> migrationOpportunities(TechnologyProfile profile) {
        List<MigrationOpportunity> opportunities = new ArrayList<>();
        if (profile == null || profile.isEmpty()) {
            return opportunities;
        }
        boolean cloud = profile.hasCloudProvider();
        if (!profile.competingProviders().isEmpty()) {
            opportunities.add(MigrationOpportunity.COMPETITOR_MIGRATION);
        }
        if (!cloud) {
            opportunities.add(MigrationOpportunity.FIRST_CLOUD_MIGRATION);
        }
        if (profile.has(TechCategory.ECOMMERCE) && !cloud) {
            opportunities.add(MigrationOpportunity.ECOMMERCE_SCALABILITY);
        }
        if (profile.has(TechCategory.DATABASE)
            && !profile.targetCloudServices().contains(TechSignatureCatalog.MANAGED_DATABASE_SERVICE)) {
            opportunities.add(MigrationOpportunity.MANAGED_DATABASE);
        }
        if (!profile.has(TechCategory.CDN) && profile.techCount() > CDN_OPPORTUNITY_MIN_TECH) {
            opportunities.add(MigrationOpportunity.CDN);
        }
        if (profile.has(TechCategory.ANALYTICS) && !cloud) {
            opportunities.add(MigrationOpportunity.ANALYTICS_MIGRATION);
        }
        return opportunities;
    }

    public IntentSignals intentSignals(TechnologyProfile profile) {
        TechnologyProfile safe = profile == null ? TechnologyProfile.empty() : profile;
        List<IntentSignals.Indicator> indicators = new ArrayList<>();
        boolean cloud = safe.hasCloudProvider();
        if (!cloud) {
            indicators.add(new IntentSignals.Indicator("No cloud provider detected", 20));
        }
        if (cloud && !safe.hasTargetProvider()) {
            indicators.add(new IntentSignals.Indicator("Using a competing cloud provider", 30));
        }
        if (safe.has(TechCategory.ECOMMERCE) && !safe.has(TechCategory.CDN)) {
            indicators.add(new IntentSignals.Indicator("E-commerce without CDN", 25));
        }
        if (safe.has(TechCategory.DATABASE) && !cloud) {
            indicators.add(new IntentSignals.Indicator("Database workloads outside the cloud", 15));
        }
        if (safe.hasModernFrontend()) {
            indicators.add(new IntentSignals.Indicator("Modern frontend stack", 10));
        }
        int score = 0;
        for (IntentSignals.Indicator indicator : indicators) {
            score += indicator.points();
        }
        return new IntentSignals(score, indicators, IntentUrgency.fromScore(score));
    }
}

package com.prospect.leadengine.qualify.techno;

import com.prospect.leadengine.qualify.model.CloudMaturity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TechnographicClassifierTest {
    private final TechnographicClassifier classifier = new TechnographicClassifier();

    @Test
    void noTechnologiesMeansNoMaturity() {
        assertThat(classifier.maturity(TechnologyProfile.empty())).isEqualTo(CloudMaturity.NONE);
        assertThat(classifier.maturity(null)).isEqualTo(CloudMaturity.NONE);
    }

    @Test
    void competingProviderWithoutTargetServicesIsAdopting() {
        TechnologyProfile profile = TechnologyProfile.builder()
            .add("azure", TechCategory.CLOUD_PROVIDER)
            .build();
        assertThat(classifier.maturity(profile)).isEqualTo(CloudMaturity.ADOPTING);
    }

    @Test
    void targetProviderMaturityDependsOnManagedServiceCount() {
        TechnologyProfile nativeProfile = TechnologyProfile.builder()
            .add("aws", TechCategory.CLOUD_PROVIDER)
            .addTargetService("s3")
            .addTargetService("cloudfront")
            .addTargetService("lambda")
            .addTargetService("rds")
            .addTargetService("dynamodb")
            .build();
        TechnologyProfile matureProfile = TechnologyProfile.builder()
            .add("aws", TechCategory.CLOUD_PROVIDER)
            .addTargetService("s3")
            .addTargetService("cloudfront")
            .build();
        TechnologyProfile adoptingProfile = TechnologyProfile.builder()
            .add("aws", TechCategory.CLOUD_PROVIDER)
            .addTargetService("s3")
            .build();

        assertThat(classifier.maturity(nativeProfile)).isEqualTo(CloudMaturity.NATIVE);
        assertThat(classifier.maturity(matureProfile)).isEqualTo(CloudMaturity.MATURE);
        assertThat(classifier.maturity(adoptingProfile)).isEqualTo(CloudMaturity.ADOPTING);
    }

    @Test
    void twoReadinessIndicatorsWithoutCloudIsExploring() {
        TechnologyProfile exploring = TechnologyProfile.builder()
            .add("cloudflare", TechCategory.CDN)
            .add("react", TechCategory.FRONTEND)
            .build();
        TechnologyProfile single = TechnologyProfile.builder()
            .add("cloudflare", TechCategory.CDN)
            .add("wordpress", TechCategory.CMS)
            .build();

        assertThat(classifier.maturity(exploring)).isEqualTo(CloudMaturity.EXPLORING);
        assertThat(classifier.maturity(single)).isEqualTo(CloudMaturity.NONE);
    }

    @Test
    void opportunitiesForOnPremiseShop() {
        TechnologyProfile profile = TechnologyProfile.builder()
            .add("shopify", TechCategory.ECOMMERCE)
            .add("mysql", TechCategory.DATABASE)
            .add("google_analytics", TechCategory.ANALYTICS)
            .add("php", TechCategory.BACKEND)
            .build();

        assertThat(classifier.migrationOpportunities(profile)).containsExactly(
            MigrationOpportunity.FIRST_CLOUD_MIGRATION,
            MigrationOpportunity.ECOMMERCE_SCALABILITY,
            MigrationOpportunity.MANAGED_DATABASE,
            MigrationOpportunity.CDN,
            MigrationOpportunity.ANALYTICS_MIGRATION
        );
    }

    @Test
    void managedDatabaseIndicatorSuppressesDatabaseOpportunity() {
        TechnologyProfile profile = TechnologyProfile.builder()
            .add("gcp", TechCategory.CLOUD_PROVIDER)
            .add("postgresql", TechCategory.DATABASE)
            .addTargetService("rds")
            .build();

        assertThat(classifier.migrationOpportunities(profile))
            .containsExactly(MigrationOpportunity.COMPETITOR_MIGRATION);
    }

    @Test
    void intentSignalsKeepIndicatorsAndBucketUrgency() {
        TechnologyProfile onPremise = TechnologyProfile.builder()
            .add("magento", TechCategory.ECOMMERCE)
            .add("mysql", TechCategory.DATABASE)
            .build();

        IntentSignals high = classifier.intentSignals(onPremise);
        assertThat(high.score()).isEqualTo(60);
        assertThat(high.urgency()).isEqualTo(IntentUrgency.HIGH);
        assertThat(high.indicators()).extracting(IntentSignals.Indicator::points).containsExactly(20, 25, 15);

        TechnologyProfile competitor = TechnologyProfile.builder()
            .add("azure", TechCategory.CLOUD_PROVIDER)
            .add("react", TechCategory.FRONTEND)
            .build();
        IntentSignals medium = classifier.intentSignals(competitor);
        assertThat(medium.score()).isEqualTo(40);
        assertThat(medium.urgency()).isEqualTo(IntentUrgency.MEDIUM);

        TechnologyProfile onTarget = TechnologyProfile.builder()
            .add("aws", TechCategory.CLOUD_PROVIDER)
            .build();
        IntentSignals low = classifier.intentSignals(onTarget);
        assertThat(low.score()).isZero();
        assertThat(low.urgency()).isEqualTo(IntentUrgency.LOW);
        assertThat(low.indicators()).isEmpty();
    }

    @Test
    void profileFromNamesRecognisesCatalogueEntries() {
        TechnologyProfile profile = TechSignatureCatalog.profileFromNames(
            List.of("AWS", "s3", "lambda", "React", "custom-erp")
        );

        assertThat(profile.hasTargetProvider()).isTrue();
        assertThat(profile.targetCloudServices()).containsExactly("s3", "lambda");
        assertThat(profile.hasModernFrontend()).isTrue();
        assertThat(profile.techCount()).isEqualTo(5);
        assertThat(classifier.maturity(profile)).isEqualTo(CloudMaturity.MATURE);
    }
}

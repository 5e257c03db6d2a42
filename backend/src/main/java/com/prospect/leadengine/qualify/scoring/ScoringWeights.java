package com.prospect.leadengine.qualify.scoring;

import com.prospect.leadengine.config.LeadEngineProperties;

/**
 * Factor weights. Not normalised: a set that does not sum to 1.0 scales every total accordingly.
 */
public record ScoringWeights(
    double companySize,
    double digitalMaturity,
    double cloudUsage,
    double sectorFit
) {
    public static final ScoringWeights DEFAULT = new ScoringWeights(0.3, 0.25, 0.25, 0.2);

    public static ScoringWeights from(LeadEngineProperties.Weights weights) {
        if (weights == null) {
            return DEFAULT;
        }
        return new ScoringWeights(
            weights.getCompanySize(),
            weights.getDigitalMaturity(),
            weights.getCloudUsage(),
            weights.getSectorFit()
        );
    }

    public double weightOf(ScoreFactor factor) {
        return switch (factor) {
            case COMPANY_SIZE -> companySize;
            case DIGITAL_MATURITY -> digitalMaturity;
            case CLOUD_USAGE -> cloudUsage;
            case SECTOR_FIT -> sectorFit;
        };
    }
}

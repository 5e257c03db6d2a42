package com.prospect.leadengine.qualify.scoring;

public enum ScoreFactor {
    COMPANY_SIZE("company_size"),
    DIGITAL_MATURITY("digital_maturity"),
    CLOUD_USAGE("cloud_usage"),
    SECTOR_FIT("sector_fit");

    private final String key;

    ScoreFactor(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}

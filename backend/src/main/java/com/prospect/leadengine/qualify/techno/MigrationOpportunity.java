package com.prospect.leadengine.qualify.techno;

public enum MigrationOpportunity {
    COMPETITOR_MIGRATION("Migration from competitor cloud to AWS"),
    FIRST_CLOUD_MIGRATION("Cloud migration opportunity: currently on-premises or traditional hosting"),
    ECOMMERCE_SCALABILITY("E-commerce platform would benefit from elastic cloud scalability"),
    MANAGED_DATABASE("Database migration to a managed database service"),
    CDN("CDN implementation for better performance"),
    ANALYTICS_MIGRATION("Analytics workload migration to the cloud");

    private final String description;

    MigrationOpportunity(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}

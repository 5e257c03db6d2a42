package com.prospect.leadengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "leads")
public class LeadEngineProperties {
    private static final String DEFAULT_USER_AGENT = "lead-engine/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 5;
    private int requestTimeoutSeconds = 10;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Scoring scoring = new Scoring();
    private Technographics technographics = new Technographics();
    private JobChange jobChange = new JobChange();
    private Playlists playlists = new Playlists();
    private Recommendations recommendations = new Recommendations();
    private Crm crm = new Crm();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Technographics getTechnographics() {
        return technographics;
    }

    public void setTechnographics(Technographics technographics) {
        this.technographics = technographics;
    }

    public JobChange getJobChange() {
        return jobChange;
    }

    public void setJobChange(JobChange jobChange) {
        this.jobChange = jobChange;
    }

    public Playlists getPlaylists() {
        return playlists;
    }

    public void setPlaylists(Playlists playlists) {
        this.playlists = playlists;
    }

    public Recommendations getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(Recommendations recommendations) {
        this.recommendations = recommendations;
    }

    public Crm getCrm() {
        return crm;
    }

    public void setCrm(Crm crm) {
        this.crm = crm;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scoring {
        private Weights weights = new Weights();

        public Weights getWeights() {
            return weights;
        }

        public void setWeights(Weights weights) {
            this.weights = weights;
        }
    }

    /**
     * Factor weights. Expected to sum to 1.0 but never normalised; negative values are clamped to zero.
     */
    public static class Weights {
        private double companySize = 0.3;
        private double digitalMaturity = 0.25;
        private double cloudUsage = 0.25;
        private double sectorFit = 0.2;

        public double getCompanySize() {
            return Math.max(0.0, companySize);
        }

        public void setCompanySize(double companySize) {
            this.companySize = companySize;
        }

        public double getDigitalMaturity() {
            return Math.max(0.0, digitalMaturity);
        }

        public void setDigitalMaturity(double digitalMaturity) {
            this.digitalMaturity = digitalMaturity;
        }

        public double getCloudUsage() {
            return Math.max(0.0, cloudUsage);
        }

        public void setCloudUsage(double cloudUsage) {
            this.cloudUsage = cloudUsage;
        }

        public double getSectorFit() {
            return Math.max(0.0, sectorFit);
        }

        public void setSectorFit(double sectorFit) {
            this.sectorFit = sectorFit;
        }
    }

    public static class Technographics {
        private boolean enabled = true;
        private int parallelism = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getParallelism() {
            return Math.max(1, parallelism);
        }

        public void setParallelism(int parallelism) {
            this.parallelism = Math.max(1, parallelism);
        }
    }

    public static class JobChange {
        private int pollLimit = 100;
        private int fetchDelayMs = 2000;
        private int inactivityDays = 365;
        private int eventRetentionDays = 365;
        private Daemon daemon = new Daemon();

        public int getPollLimit() {
            return Math.max(1, pollLimit);
        }

        public void setPollLimit(int pollLimit) {
            this.pollLimit = Math.max(1, pollLimit);
        }

        public int getFetchDelayMs() {
            return Math.max(1, fetchDelayMs);
        }

        public void setFetchDelayMs(int fetchDelayMs) {
            this.fetchDelayMs = Math.max(1, fetchDelayMs);
        }

        public int getInactivityDays() {
            return Math.max(1, inactivityDays);
        }

        public void setInactivityDays(int inactivityDays) {
            this.inactivityDays = Math.max(1, inactivityDays);
        }

        public int getEventRetentionDays() {
            return Math.max(1, eventRetentionDays);
        }

        public void setEventRetentionDays(int eventRetentionDays) {
            this.eventRetentionDays = Math.max(1, eventRetentionDays);
        }

        public Daemon getDaemon() {
            return daemon;
        }

        public void setDaemon(Daemon daemon) {
            this.daemon = daemon;
        }
    }

    public static class Playlists {
        private int defaultTargetSize = 50;
        private int refreshHours = 24;
        private Daemon daemon = new Daemon();

        public int getDefaultTargetSize() {
            return Math.max(1, defaultTargetSize);
        }

        public void setDefaultTargetSize(int defaultTargetSize) {
            this.defaultTargetSize = Math.max(1, defaultTargetSize);
        }

        public int getRefreshHours() {
            return Math.max(1, refreshHours);
        }

        public void setRefreshHours(int refreshHours) {
            this.refreshHours = Math.max(1, refreshHours);
        }

        public Daemon getDaemon() {
            return daemon;
        }

        public void setDaemon(Daemon daemon) {
            this.daemon = daemon;
        }
    }

    public static class Daemon {
        private boolean enabled = false;
        private int pollIntervalMinutes = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalMinutes() {
            return Math.max(1, pollIntervalMinutes);
        }

        public void setPollIntervalMinutes(int pollIntervalMinutes) {
            this.pollIntervalMinutes = Math.max(1, pollIntervalMinutes);
        }
    }

    public static class Recommendations {
        private List<String> defaultPreferredSectors = new ArrayList<>(List.of("banking", "technology", "retail"));
        private List<String> defaultPreferredCompanySizes = new ArrayList<>(List.of("medium", "large", "enterprise"));
        private double defaultMinScore = 60.0;
        private int defaultMaxLeadsPerDay = 10;
        private List<String> specializationKeywords = new ArrayList<>(
            List.of("aws", "cloud", "migration", "banking", "fintech")
        );

        public List<String> getDefaultPreferredSectors() {
            return defaultPreferredSectors;
        }

        public void setDefaultPreferredSectors(List<String> defaultPreferredSectors) {
            this.defaultPreferredSectors = defaultPreferredSectors == null ? new ArrayList<>() : defaultPreferredSectors;
        }

        public List<String> getDefaultPreferredCompanySizes() {
            return defaultPreferredCompanySizes;
        }

        public void setDefaultPreferredCompanySizes(List<String> defaultPreferredCompanySizes) {
            this.defaultPreferredCompanySizes = defaultPreferredCompanySizes == null
                ? new ArrayList<>()
                : defaultPreferredCompanySizes;
        }

        public double getDefaultMinScore() {
            return Math.max(0.0, defaultMinScore);
        }

        public void setDefaultMinScore(double defaultMinScore) {
            this.defaultMinScore = defaultMinScore;
        }

        public int getDefaultMaxLeadsPerDay() {
            return Math.max(1, defaultMaxLeadsPerDay);
        }

        public void setDefaultMaxLeadsPerDay(int defaultMaxLeadsPerDay) {
            this.defaultMaxLeadsPerDay = Math.max(1, defaultMaxLeadsPerDay);
        }

        public List<String> getSpecializationKeywords() {
            return specializationKeywords;
        }

        public void setSpecializationKeywords(List<String> specializationKeywords) {
            this.specializationKeywords = specializationKeywords == null ? new ArrayList<>() : specializationKeywords;
        }
    }

    public static class Crm {
        private double minScore = 60.0;

        public double getMinScore() {
            return Math.max(0.0, minScore);
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }
    }
}

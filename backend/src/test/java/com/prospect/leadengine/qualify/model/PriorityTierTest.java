package com.prospect.leadengine.qualify.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityTierTest {

    @Test
    void tiersFollowScoreThresholds() {
        assertThat(PriorityTier.fromScore(80.0)).isEqualTo(PriorityTier.HOT);
        assertThat(PriorityTier.fromScore(79.99)).isEqualTo(PriorityTier.WARM);
        assertThat(PriorityTier.fromScore(60.0)).isEqualTo(PriorityTier.WARM);
        assertThat(PriorityTier.fromScore(40.0)).isEqualTo(PriorityTier.COOL);
        assertThat(PriorityTier.fromScore(39.99)).isEqualTo(PriorityTier.COLD);
        assertThat(PriorityTier.fromScore(0.0)).isEqualTo(PriorityTier.COLD);
    }

    @Test
    void priorityIsDerivedFromScoreOnRead() {
        Lead lead = Lead.builder("Acme").score(85.0).build();
        assertThat(lead.priority()).isEqualTo(PriorityTier.HOT);
        assertThat(lead.withScore(42.0, null).priority()).isEqualTo(PriorityTier.COOL);
    }

    @Test
    void enumValuesParseCaseInsensitively() {
        assertThat(Sector.fromValue(" Banking ")).isEqualTo(Sector.BANKING);
        assertThat(Sector.fromValue("aerospace")).isNull();
        assertThat(CompanySize.fromValue("ENTERPRISE")).isEqualTo(CompanySize.ENTERPRISE);
        assertThat(CloudMaturity.fromValue("native")).isEqualTo(CloudMaturity.NATIVE);
    }
}

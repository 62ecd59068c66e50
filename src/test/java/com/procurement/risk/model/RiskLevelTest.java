package com.procurement.risk.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLevelTest {

    @Test
    void fromScore_boundaries() {
        assertThat(RiskLevel.fromScore(0.0)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(39.99)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(40.0)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(70.0)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(70.01)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromScore(100.0)).isEqualTo(RiskLevel.HIGH);
    }
}

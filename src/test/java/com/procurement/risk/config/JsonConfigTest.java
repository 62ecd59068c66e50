package com.procurement.risk.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.procurement.risk.model.InteractionEffect;
import com.procurement.risk.model.PatternContribution;
import com.procurement.risk.model.PatternType;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskAnalysis;
import com.procurement.risk.model.RiskLevel;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonConfigTest {

    private final ObjectMapper mapper = JsonConfig.snakeCaseMapper();

    @Test
    void riskAnalysis_serialisedInSnakeCase() throws Exception {
        RiskAnalysis analysis = RiskAnalysis.builder()
                .procurementId("TND-1")
                .overallRiskScore(65.0)
                .riskLevel(RiskLevel.MEDIUM)
                .riskPatterns(List.of(PatternContribution.builder()
                        .patternType(PatternType.BUDGET_ANOMALY)
                        .scoreContribution(65.0)
                        .weight(1.0)
                        .rawScore(65.0)
                        .evidence(Map.of("baseline_status", "UNAVAILABLE"))
                        .explanation("Award above budget.")
                        .build()))
                .interactionEffects(InteractionEffect.NONE)
                .summaryText("Summary.")
                .disclaimer("Disclaimer.")
                .generatedAt(Instant.parse("2024-11-05T10:15:30Z"))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(analysis));

        assertThat(json.get("procurement_id").asText()).isEqualTo("TND-1");
        assertThat(json.get("overall_risk_score").asDouble()).isEqualTo(65.0);
        assertThat(json.get("risk_level").asText()).isEqualTo("MEDIUM");
        assertThat(json.get("generated_at").asText()).isEqualTo("2024-11-05T10:15:30Z");
        assertThat(json.get("interaction_effects").get("multiplier").asDouble()).isEqualTo(1.0);
        assertThat(json.get("interaction_effects").has("reason")).isFalse();

        JsonNode pattern = json.get("risk_patterns").get(0);
        assertThat(pattern.get("pattern_type").asText()).isEqualTo("BUDGET_ANOMALY");
        assertThat(pattern.get("score_contribution").asDouble()).isEqualTo(65.0);
        assertThat(pattern.has("sub_type")).isFalse();
        assertThat(pattern.get("evidence").get("baseline_status").asText()).isEqualTo("UNAVAILABLE");
    }

    @Test
    void procurementRecord_readFromSnakeCase() throws Exception {
        String json = "{\"tender_id\":\"TND-9\",\"department_id\":\"DEPT-1\",\"estimated_budget\":2000000,"
                + "\"bidder_count\":1,\"publication_date\":\"2024-03-01\",\"procurement_year\":2024,"
                + "\"unexpected_field\":true}";

        ProcurementRecord record = mapper.readValue(json, ProcurementRecord.class);

        assertThat(record.getTenderId()).isEqualTo("TND-9");
        assertThat(record.getBidderCount()).isEqualTo(1);
        assertThat(record.getPublicationDate()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(record.getAwardedAmount()).isNull();
        assertThat(record.getEstimatedBudgetLakhs()).isEqualTo(20.0);
    }
}

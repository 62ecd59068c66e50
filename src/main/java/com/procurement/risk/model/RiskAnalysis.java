package com.procurement.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * The explainability report for one procurement record. Re-analysis produces
 * a new instance; an existing report is never changed.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Risk analysis of a procurement record with evidence, summary and disclaimer")
public class RiskAnalysis {

    @Schema(description = "Tender identifier of the analysed record", example = "TND-2024-00017")
    String procurementId;

    @Schema(description = "Combined risk score (0-100). LOW < 40, MEDIUM 40-70, HIGH > 70", example = "82.4")
    double overallRiskScore;

    @Schema(description = "Risk level derived from the overall score", example = "HIGH")
    RiskLevel riskLevel;

    @Schema(description = "Detected patterns in detector registration order")
    List<PatternContribution> riskPatterns;

    @Schema(description = "Interaction multiplier and its trigger")
    InteractionEffect interactionEffects;

    @Schema(description = "Plain-language summary built from fixed templates")
    String summaryText;

    @Schema(description = "Fixed disclaimer text")
    String disclaimer;

    @Schema(description = "When the analysis was generated")
    Instant generatedAt;
}

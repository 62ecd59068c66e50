package com.procurement.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@Schema(description = "One detected anomaly pattern with its bounded score and supporting evidence")
public class RiskPattern {

    @Schema(description = "Type of pattern", example = "SINGLE_BIDDER")
    PatternType patternType;

    @Schema(description = "Sub-type, only set for SPEC_TAILORING", example = "BRAND_REFERENCE")
    TailoringSubType subType;

    @Schema(description = "Pattern score (0-100) before weighting", example = "95.0")
    double score;

    @Schema(description = "Facts used in the score formula, in insertion order")
    Map<String, Object> evidence;

    @Schema(description = "Plain-language explanation produced by the detector")
    String explanation;

    @Schema(description = "Identifier of the template the explanation was rendered from",
            example = "pattern.single-bidder@v1")
    String templateId;
}

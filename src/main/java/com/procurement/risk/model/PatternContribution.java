package com.procurement.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@Schema(description = "A detected pattern as reported, with its share of the overall score")
public class PatternContribution {

    @Schema(description = "Type of pattern", example = "COMPRESSED_DEADLINE")
    PatternType patternType;

    @Schema(description = "Sub-type, only set for SPEC_TAILORING", example = "RESTRICTIVE_LANGUAGE")
    TailoringSubType subType;

    @Schema(description = "Share of the overall risk score attributed to this pattern", example = "41.3")
    double scoreContribution;

    @Schema(description = "Configured weight of this pattern type", example = "0.9")
    double weight;

    @Schema(description = "Pattern score (0-100) before weighting", example = "68.0")
    double rawScore;

    @Schema(description = "Facts used in the score formula")
    Map<String, Object> evidence;

    @Schema(description = "Plain-language explanation")
    String explanation;
}

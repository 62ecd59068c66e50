package com.procurement.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A phrase in the specification text that narrows the supplier pool")
public class TailoringMatch {

    @Schema(description = "Matched text as it appears in the specification", example = "Cisco")
    String phrase;

    @Schema(description = "Start character offset (inclusive)", example = "42")
    int start;

    @Schema(description = "End character offset (exclusive)", example = "47")
    int end;

    @Schema(description = "Kind of indicator", example = "BRAND_REFERENCE")
    IndicatorType indicatorType;
}

package com.procurement.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Compounding applied when several patterns co-occur")
public class InteractionEffect {

    public static final InteractionEffect NONE = new InteractionEffect(1.0, null);

    @Schema(description = "Multiplier applied to the weighted sum", example = "1.2075")
    double multiplier;

    @Schema(description = "Why the multiplier is above 1.0; absent when no interaction applied",
            example = "2 patterns co-occur, including a compressed bidding window together with a single bid")
    String reason;
}

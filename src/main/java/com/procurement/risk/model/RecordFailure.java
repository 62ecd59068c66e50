package com.procurement.risk.model;

import com.procurement.risk.engine.AnalysisState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A record of a batch whose analysis did not complete")
public class RecordFailure {

    @Schema(description = "Tender identifier of the failed record", example = "TND-2024-00017")
    String tenderId;

    @Schema(description = "Failure category", example = "timeout",
            allowableValues = {"invalid_input", "timeout", "language_safety", "rejected", "error"})
    String reason;

    @Schema(description = "Failure message")
    String message;

    @Schema(description = "Whether the record may be resubmitted unchanged")
    boolean retryable;

    @Schema(description = "State in which the analysis failed, absent when it never started", example = "DETECTING")
    AnalysisState failedState;

    @Schema(description = "Template that produced deny-listed text, only for language_safety failures",
            example = "pattern.single-bidder@v1")
    String templateId;
}

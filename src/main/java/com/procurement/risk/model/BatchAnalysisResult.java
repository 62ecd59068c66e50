package com.procurement.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a batch. Every submitted record appears in exactly one of the
 * three lists, each kept in submission order.
 */
@Value
@Builder
@Schema(description = "Completed analyses, per-record failures and records skipped after cancellation")
public class BatchAnalysisResult {

    List<RiskAnalysis> analyses;

    List<RecordFailure> failures;

    @Schema(description = "Records never started because the batch was cancelled")
    List<String> skippedTenderIds;

    public int getTotal() {
        return analyses.size() + failures.size() + skippedTenderIds.size();
    }

    public boolean isCancelled() {
        return !skippedTenderIds.isEmpty();
    }
}

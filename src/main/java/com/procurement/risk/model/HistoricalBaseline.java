package com.procurement.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Aggregate statistics for one category/region over a span of procurement years.
 * An unknown baseline is represented by an absent value, never by zeros.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Historical statistics used as the comparison reference for anomaly detection")
public class HistoricalBaseline {

    @Schema(description = "Procurement category", example = "ROAD_CONSTRUCTION")
    String category;

    @Schema(description = "Geographic region", example = "NORTH")
    String region;

    @Schema(description = "First procurement year covered (inclusive)", example = "2022")
    int fromYear;

    @Schema(description = "Last procurement year covered (inclusive)", example = "2024")
    int toYear;

    @Schema(description = "Mean awarded amount", example = "1000000.0")
    double meanAmount;

    @Schema(description = "Standard deviation of awarded amount", example = "100000.0")
    double stddevAmount;

    @Schema(description = "Average number of bidders per tender", example = "4.2")
    double averageBidderCount;

    @Schema(description = "Median days between publication and submission deadline", example = "21")
    double medianBiddingWindowDays;

    @Schema(description = "Number of historical tenders aggregated", example = "120")
    long sampleSize;

    public boolean isUsable(long minSampleSize) {
        return sampleSize >= minSampleSize && sampleSize > 0;
    }
}

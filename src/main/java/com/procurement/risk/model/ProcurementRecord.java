package com.procurement.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
@Schema(description = "A validated tender/award record handed over by ingestion")
public class ProcurementRecord {

    @Schema(description = "Unique tender identifier", example = "TND-2024-00017")
    String tenderId;

    @Schema(description = "Procuring department identifier", example = "DEPT-PWD-07")
    String departmentId;

    @Schema(description = "Procuring department name", example = "Public Works Department")
    String departmentName;

    @Schema(description = "Procurement category", example = "ROAD_CONSTRUCTION")
    String category;

    @Schema(description = "Geographic region", example = "NORTH")
    String region;

    @Schema(description = "Estimated budget in currency units", example = "2500000.00")
    double estimatedBudget;

    @Schema(description = "Date the tender was published", example = "2024-03-01")
    LocalDate publicationDate;

    @Schema(description = "Last date for bid submission", example = "2024-03-05")
    LocalDate submissionDeadline;

    @Schema(description = "Number of bids received. Null when unknown.", example = "1")
    Integer bidderCount;

    @Schema(description = "Awarded vendor identifier. Null when not yet awarded.", example = "VEND-0042")
    String awardedVendorId;

    @Schema(description = "Awarded amount in currency units. Null when not yet awarded.", example = "3100000.00")
    Double awardedAmount;

    @Schema(description = "Award date. Null when not yet awarded.", example = "2024-04-12")
    LocalDate awardDate;

    @Schema(description = "Free-text technical specification")
    String specificationText;

    @Schema(description = "Financial year of the procurement", example = "2024")
    int procurementYear;

    /**
     * Estimated budget expressed in lakhs (1 lakh = 100,000 currency units).
     */
    public double getEstimatedBudgetLakhs() {
        return estimatedBudget / 100_000.0;
    }
}

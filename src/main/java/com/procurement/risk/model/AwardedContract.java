package com.procurement.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
@Schema(description = "A past contract award, used to detect repeated awards to one vendor")
public class AwardedContract {

    @Schema(description = "Tender identifier of the award", example = "TND-2023-00981")
    String tenderId;

    @Schema(description = "Awarded vendor", example = "VEND-0042")
    String vendorId;

    @Schema(description = "Awarding department", example = "DEPT-PWD-07")
    String departmentId;

    @Schema(description = "Awarded amount in currency units", example = "2400000.00")
    double amount;

    @Schema(description = "Award date", example = "2023-11-02")
    LocalDate awardDate;
}

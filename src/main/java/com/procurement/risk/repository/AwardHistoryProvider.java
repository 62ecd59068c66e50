package com.procurement.risk.repository;

import com.procurement.risk.model.AwardedContract;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only lookup of past contract awards.
 */
public interface AwardHistoryProvider {

    /**
     * Awards from the vendor to the department dated {@code from..to} inclusive,
     * most recent first.
     */
    List<AwardedContract> findAwards(String vendorId, String departmentId, LocalDate from, LocalDate to);
}

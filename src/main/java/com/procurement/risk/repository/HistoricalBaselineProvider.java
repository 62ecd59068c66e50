package com.procurement.risk.repository;

import com.procurement.risk.model.HistoricalBaseline;

import java.util.Optional;

/**
 * Read-only lookup of category/region statistics. Contents stay fixed for the
 * lifetime of a batch; refreshing them is an out-of-band operation.
 */
public interface HistoricalBaselineProvider {

    /**
     * Baseline for the category and region over procurement years
     * {@code fromYear..toYear} inclusive, or empty when no history exists.
     */
    Optional<HistoricalBaseline> findBaseline(String category, String region, int fromYear, int toYear);
}

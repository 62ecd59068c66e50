package com.procurement.risk.engine;

import com.procurement.risk.model.AwardedContract;
import com.procurement.risk.model.HistoricalBaseline;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Read-only data looked up once per record before detection starts.
 */
@Value
@Builder
public class DetectionContext {

    public static final DetectionContext EMPTY = DetectionContext.builder().build();

    // Null when no baseline exists or the lookup timed out
    HistoricalBaseline historicalBaseline;

    // Past awards from the record's vendor to its department; may include the record itself
    @Builder.Default
    List<AwardedContract> vendorAwards = Collections.emptyList();

    public Optional<HistoricalBaseline> baseline() {
        return Optional.ofNullable(historicalBaseline);
    }

    /**
     * The baseline, if present and backed by at least {@code minSampleSize} tenders.
     */
    public Optional<HistoricalBaseline> usableBaseline(long minSampleSize) {
        return baseline().filter(b -> b.isUsable(minSampleSize));
    }
}

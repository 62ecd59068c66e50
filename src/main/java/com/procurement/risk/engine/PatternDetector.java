package com.procurement.risk.engine;

import com.procurement.risk.model.PatternType;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskPattern;
import com.procurement.risk.model.WeightConfig;

import java.util.Optional;

/**
 * Contract shared by the five pattern detectors. Each implementation handles
 * exactly one {@link PatternType}; the set is closed and registered in
 * {@link DetectorEngine}.
 *
 * <p>Detectors are stateless and read only the record and the detection
 * context, so they can be evaluated concurrently. A missing optional field
 * makes a detector not applicable; it is never an error.
 */
public interface PatternDetector {

    /**
     * The pattern type this detector produces.
     */
    PatternType getPatternType();

    /**
     * Whether the record carries every field this detector needs.
     */
    boolean isApplicable(ProcurementRecord record);

    /**
     * Evaluate an applicable record.
     *
     * @param record  the record under analysis
     * @param context baseline and award history looked up for this record
     * @return the detected pattern, or empty when the pattern does not fire
     */
    Optional<RiskPattern> detect(ProcurementRecord record, DetectionContext context);

    default double weight(WeightConfig weights) {
        return weights.weightOf(getPatternType());
    }

    static double clampScore(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(100.0, score));
    }
}

package com.procurement.risk.model;

/**
 * The closed set of risk patterns. Declaration order is the detector
 * registration order used for scoring and reporting.
 */
public enum PatternType {
    SINGLE_BIDDER("Single bidder"),
    VENDOR_REPETITION("Repeated vendor awards"),
    COMPRESSED_DEADLINE("Compressed bidding window"),
    BUDGET_ANOMALY("Award above budget"),
    SPEC_TAILORING("Restrictive specification");

    private final String displayName;

    PatternType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

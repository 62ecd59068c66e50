package com.procurement.risk.model;

public enum TailoringSubType {
    BRAND_REFERENCE,
    RESTRICTIVE_LANGUAGE,
    COMBINED;

    public static TailoringSubType of(boolean brandThresholdMet, boolean restrictiveThresholdMet) {
        if (brandThresholdMet && restrictiveThresholdMet) return COMBINED;
        if (brandThresholdMet) return BRAND_REFERENCE;
        return RESTRICTIVE_LANGUAGE;
    }
}

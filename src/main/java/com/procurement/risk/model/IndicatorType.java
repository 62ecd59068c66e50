package com.procurement.risk.model;

public enum IndicatorType {
    BRAND_REFERENCE,
    RESTRICTIVE_LANGUAGE
}

package com.procurement.risk.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel fromScore(double score) {
        if (score > 70) return HIGH;
        if (score >= 40) return MEDIUM;
        return LOW;
    }
}

package com.procurement.risk.exception;

import java.time.Duration;

public class AnalysisTimeoutException extends RiskAnalysisException {

    private final Duration budget;

    public AnalysisTimeoutException(String tenderId, Duration budget) {
        super(tenderId, String.format("Analysis of tender %s exceeded its %d ms budget",
                tenderId, budget.toMillis()));
        this.budget = budget;
    }

    public Duration getBudget() {
        return budget;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

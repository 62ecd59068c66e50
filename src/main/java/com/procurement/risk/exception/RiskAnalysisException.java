package com.procurement.risk.exception;

import com.procurement.risk.engine.AnalysisState;

/**
 * Failure of a single record's analysis. Never affects other records.
 */
public class RiskAnalysisException extends RuntimeException {

    private final String tenderId;
    private AnalysisState failedState;

    public RiskAnalysisException(String tenderId, String message) {
        super(message);
        this.tenderId = tenderId;
    }

    public RiskAnalysisException(String tenderId, String message, Throwable cause) {
        super(message, cause);
        this.tenderId = tenderId;
    }

    public String getTenderId() {
        return tenderId;
    }

    public AnalysisState getFailedState() {
        return failedState;
    }

    public RiskAnalysisException failedIn(AnalysisState state) {
        this.failedState = state;
        return this;
    }

    public boolean isRetryable() {
        return false;
    }
}

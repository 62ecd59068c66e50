package com.procurement.risk.engine;

/**
 * Lifecycle of one record's analysis. Non-terminal states advance strictly in
 * declaration order; FAILED is reachable from any non-terminal state.
 */
public enum AnalysisState {
    RECEIVED,
    DETECTING,
    SCORING,
    EXPLAINING,
    VALIDATING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canTransitionTo(AnalysisState next) {
        if (isTerminal()) return false;
        if (next == FAILED) return true;
        return next.ordinal() == ordinal() + 1;
    }
}

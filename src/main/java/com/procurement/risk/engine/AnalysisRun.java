package com.procurement.risk.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the state of a single record's analysis. Confined to the thread that
 * runs the pipeline for that record.
 */
public class AnalysisRun {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRun.class);

    private final String tenderId;
    private AnalysisState state = AnalysisState.RECEIVED;

    public AnalysisRun(String tenderId) {
        this.tenderId = tenderId;
    }

    public void advance(AnalysisState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(String.format(
                    "Illegal analysis transition for tender %s: %s -> %s", tenderId, state, next));
        }
        log.debug("Tender {}: {} -> {}", tenderId, state, next);
        state = next;
    }

    /**
     * Moves to FAILED and returns the state the run failed in.
     */
    public AnalysisState fail() {
        AnalysisState failedIn = state;
        if (!state.isTerminal()) {
            state = AnalysisState.FAILED;
            log.debug("Tender {}: {} -> FAILED", tenderId, failedIn);
        }
        return failedIn;
    }

    public AnalysisState getState() {
        return state;
    }

    public String getTenderId() {
        return tenderId;
    }
}

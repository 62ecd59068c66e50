package com.procurement.risk.exception;

/**
 * A worker pool refused a record's task because it was saturated.
 * The record itself is fine and can be resubmitted later.
 */
public class CapacityExceededException extends RiskAnalysisException {

    private final String pool;

    public CapacityExceededException(String tenderId, String pool, Throwable cause) {
        super(tenderId, String.format("The %s pool is saturated; tender %s was not analysed", pool, tenderId), cause);
        this.pool = pool;
    }

    public String getPool() {
        return pool;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

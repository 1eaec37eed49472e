package com.marketdata.jobs.domain;

/**
 * Status of a single job run.
 * RUNNING is the only non-terminal state.
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}

package com.marketdata.jobs.jobs;

/**
 * Call path that started a run.
 */
public enum TriggerSource {
    SCHEDULED,
    MANUAL,
    CHAINED
}

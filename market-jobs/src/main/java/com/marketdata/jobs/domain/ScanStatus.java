package com.marketdata.jobs.domain;

/**
 * Status enum for EOD scan run lifecycle.
 */
public enum ScanStatus {
    RUNNING,
    COMPLETED,
    FAILED
}

package com.marketdata.jobs.domain;

/**
 * Classification of a per-symbol scan diagnostic.
 * NO_DATA rows are informational, PROVIDER_ERROR rows may be retried,
 * AUTH is written once when the upstream token cannot be obtained.
 */
public enum ScanErrorType {
    NO_DATA,
    PROVIDER_ERROR,
    AUTH
}

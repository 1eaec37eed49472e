package com.marketdata.jobs.domain;

/**
 * How a job configuration is triggered.
 */
public enum ScheduleType {
    INTERVAL,
    CRON
}

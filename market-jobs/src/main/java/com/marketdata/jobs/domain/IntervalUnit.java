package com.marketdata.jobs.domain;

import java.time.Duration;

public enum IntervalUnit {
    SECONDS,
    MINUTES,
    HOURS;

    public Duration toDuration(long value) {
        return switch (this) {
            case SECONDS -> Duration.ofSeconds(value);
            case MINUTES -> Duration.ofMinutes(value);
            case HOURS -> Duration.ofHours(value);
        };
    }
}

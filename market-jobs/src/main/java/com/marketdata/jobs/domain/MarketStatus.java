package com.marketdata.jobs.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Snapshot of the market session at a point in time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarketStatus {

    public enum ClosedReason {
        WEEKEND, HOLIDAY, BEFORE_HOURS, AFTER_HOURS
    }

    private boolean open;
    private ClosedReason reason;
    private ZonedDateTime closesAt;
    private ZonedDateTime nextOpen;
    private ZonedDateTime currentTime;
}

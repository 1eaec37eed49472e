package com.marketdata.jobs.service.scan;

import lombok.Value;

/**
 * Row counts of one price upsert.
 */
@Value
public class UpsertResult {

    public static final UpsertResult EMPTY = new UpsertResult(0, 0, 0);

    int inserted;
    int updated;
    int skipped;

    public UpsertResult plus(UpsertResult other) {
        return new UpsertResult(inserted + other.inserted, updated + other.updated, skipped + other.skipped);
    }
}

package com.marketdata.jobs.service.scan;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of fetching and storing one symbol.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SymbolFetchOutcome {

    public enum Kind {
        STORED, NO_DATA, FAILED
    }

    String symbol;
    Kind kind;
    UpsertResult upsert;
    String errorMessage;
    Integer httpStatus;

    public static SymbolFetchOutcome stored(String symbol, UpsertResult upsert) {
        return new SymbolFetchOutcome(symbol, Kind.STORED, upsert, null, null);
    }

    public static SymbolFetchOutcome noData(String symbol) {
        return new SymbolFetchOutcome(symbol, Kind.NO_DATA, UpsertResult.EMPTY, null, null);
    }

    public static SymbolFetchOutcome failed(String symbol, String errorMessage, Integer httpStatus) {
        return new SymbolFetchOutcome(symbol, Kind.FAILED, UpsertResult.EMPTY, errorMessage, httpStatus);
    }
}

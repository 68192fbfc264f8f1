package com.tradejournal.domain.enums;

/** Outcome of one statement import. Only IMPORTED writes to the store. */
public enum ImportStatus {
    IMPORTED,
    EMPTY_STATEMENT,
    NO_ROWS_MATCH_FILTERS,
    ALL_DUPLICATES
}

package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.ImportStatus;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of one statement import.
 *
 * <p>Row counters describe how the statement was whittled down: parsed, then filtered by the
 * date cutoff, then deduplicated against stored and already-admitted rows.
 */
@Getter
@Builder
public class ImportResult {

    private final ImportStatus status;
    private final String account;
    private final String broker;
    private final int parsedRows;
    private final int filteredRows;
    private final int duplicateRows;
    private final int insertedCount;
    private final String message;

    public static ImportResult emptyStatement(String account, String broker) {
        return ImportResult.builder()
                .status(ImportStatus.EMPTY_STATEMENT)
                .account(account)
                .broker(broker)
                .message("No rows found in CSV.")
                .build();
    }
}

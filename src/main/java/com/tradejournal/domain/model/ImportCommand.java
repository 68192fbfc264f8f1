package com.tradejournal.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything one statement import needs.
 */
@Getter
@Builder
public class ImportCommand {

    private final String ownerId;
    private final String brokerName;
    private final String accountName;
    private final String statementText;

    /** Flat fee per contract deducted from futures rows. Null or zero disables it. */
    private final BigDecimal feePerContract;

    /** Rows timestamped before this UTC date are skipped. Null disables the cutoff. */
    private final LocalDate earliestDate;
}

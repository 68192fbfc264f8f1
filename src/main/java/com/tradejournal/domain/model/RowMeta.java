package com.tradejournal.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Per-row facts only the FIFO reconciler needs. Discarded once P&L is assigned.
 */
@Getter
@Builder
public class RowMeta {

    private final String side;

    /** Absolute fill quantity; null when the row had none. */
    private final BigDecimal quantity;

    /** Null when the row had no price column. */
    private final BigDecimal fillPrice;

    @Builder.Default
    private final BigDecimal feePerUnit = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal totalFee = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal multiplier = BigDecimal.ONE;
}

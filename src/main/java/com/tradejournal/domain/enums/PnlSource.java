package com.tradejournal.domain.enums;

/**
 * How a broker's statement expresses realized P&L.
 */
public enum PnlSource {
    /** Rows are individual fills; realized P&L is rebuilt by FIFO lot matching. */
    FILLS,
    /** Rows already carry a realized P&L figure per trade. */
    TRADE_PNL;

    public boolean requiresReconciliation() {
        return this == FILLS;
    }
}

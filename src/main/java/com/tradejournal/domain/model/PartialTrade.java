package com.tradejournal.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A trade as read from one statement row, before it is stamped with owner and source.
 *
 * <p>{@code entryTimestamp}, {@code quantity} and {@code pnl} are null when the row did not
 * provide them. The string fields are never null; a missing value is the empty string.
 * Once reconciliation has run, {@code pnl} is always set (zero when it cannot be derived).
 */
@Data
@Builder
public class PartialTrade {

    private Instant entryTimestamp;

    /** yyyy-MM-dd in UTC when the timestamp parsed, otherwise the raw date cell. */
    @Builder.Default
    private String date = "";

    /** HH:mm in UTC when the timestamp parsed, otherwise the raw time cell. */
    @Builder.Default
    private String time = "";

    @Builder.Default
    private String side = "";

    @Builder.Default
    private String type = "";

    @Builder.Default
    private String ticker = "";

    /** Absolute quantity. */
    private BigDecimal quantity;

    private BigDecimal pnl;

    /** Status or free-form notes column. */
    @Builder.Default
    private String change = "";

    public boolean hasPnl() {
        return pnl != null;
    }

    public boolean hasQuantity() {
        return quantity != null;
    }

    public boolean hasTimestamp() {
        return entryTimestamp != null;
    }
}

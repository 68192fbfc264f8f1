package com.tradejournal.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A canonical, persisted trade record as consumed by the journal views.
 *
 * <p>Carries the normalized trade fields plus the owner and the account/broker it was
 * imported from. {@code pnl} is non-null for every record written by the importer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRecord {

    /** Longest text kept from a statement cell; longer cells are cut to this length. */
    public static final int MAX_TEXT_LENGTH = 1024;

    private String id;
    private String ownerId;
    private Instant entryTimestamp;
    private String date;
    private String time;
    private String side;
    private String type;
    private String ticker;
    private BigDecimal quantity;
    private BigDecimal pnl;
    private String change;
    private String sourceAccount;
    private String sourceBroker;
    private LocalDateTime createdAt;
}

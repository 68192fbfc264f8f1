package com.tradejournal.entity;

import com.tradejournal.domain.model.TradeRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_records table.
 * One row per imported trade, scoped by owner and tagged with the account and broker it came from.
 * Text taken from statement cells is at most {@link TradeRecord#MAX_TEXT_LENGTH} characters.
 */
@Entity
@Table(
        name = "trade_records",
        indexes = {@Index(name = "idx_trade_records_owner_account", columnList = "owner_id, source_account")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeRecordEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "owner_id", length = 64, nullable = false)
    private String ownerId;

    @Column(name = "entry_ts")
    private Instant entryTimestamp;

    @Column(name = "trade_date", length = TradeRecord.MAX_TEXT_LENGTH)
    private String date;

    @Column(name = "trade_time", length = TradeRecord.MAX_TEXT_LENGTH)
    private String time;

    @Column(length = TradeRecord.MAX_TEXT_LENGTH)
    private String side;

    @Column(name = "trade_type", length = TradeRecord.MAX_TEXT_LENGTH)
    private String type;

    @Column(length = TradeRecord.MAX_TEXT_LENGTH)
    private String ticker;

    @Column(precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(precision = 19, scale = 4)
    private BigDecimal pnl;

    /** Broker status or notes column, e.g. "Filled". */
    @Column(name = "change_note", length = TradeRecord.MAX_TEXT_LENGTH)
    private String change;

    @Column(name = "source_account", length = 128, nullable = false)
    private String sourceAccount;

    @Column(name = "source_broker", length = 64)
    private String sourceBroker;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}

package com.tradejournal.reconciliation;

import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.model.Lot;
import com.tradejournal.domain.model.MappedRow;
import com.tradejournal.domain.model.PartialTrade;
import com.tradejournal.domain.model.RowMeta;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives realized P&amp;L for fill-level statements by matching opposite fills first-in, first-out.
 *
 * <p>Rows are processed in entry-time order (stable for ties; rows without any time sort as the
 * epoch). Rows that already carry P&amp;L are left alone and do not touch the lot book. Every other
 * row leaves with a P&amp;L: the realized amount less its share of its own commission when it
 * closed something, otherwise zero. Opening fills record their per-unit fee on the lot, and that
 * fee is charged again when the lot closes.
 */
@Component
public class FifoReconciler {

    private static final Logger log = LoggerFactory.getLogger(FifoReconciler.class);

    /**
     * Assigns P&amp;L to every row of {@code rows} in place and returns the lots left open.
     */
    public LotBook reconcile(List<MappedRow> rows) {
        List<MappedRow> ordered = new ArrayList<>(rows);
        ordered.sort(Comparator.comparing(row -> orderingInstant(row.getTrade())));

        LotBook book = new LotBook();
        int derived = 0;
        for (MappedRow row : ordered) {
            PartialTrade trade = row.getTrade();
            if (trade.hasPnl()) {
                continue;
            }
            trade.setPnl(realize(book, trade.getTicker(), row.getMeta()));
            derived++;
        }
        log.debug("FIFO reconciliation complete: rows={}, derived={}", rows.size(), derived);
        return book;
    }

    private BigDecimal realize(LotBook book, String ticker, RowMeta meta) {
        BigDecimal quantity = meta.getQuantity();
        BigDecimal price = meta.getFillPrice();
        if (ticker == null || ticker.isEmpty() || quantity == null || quantity.signum() == 0 || price == null) {
            return BigDecimal.ZERO;
        }
        Optional<TradeSide> side = TradeSide.parse(meta.getSide());
        if (side.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal totalFee = meta.getTotalFee();
        BigDecimal feePerUnit = totalFee.divide(quantity, MathContext.DECIMAL64);

        LotBook.CloseResult result = book.close(ticker, side.get(), quantity, price);
        if (result.remaining().signum() > 0) {
            book.open(ticker, side.get(), new Lot(result.remaining(), price, feePerUnit, meta.getMultiplier()));
        }
        if (result.closedQuantity().signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal feeShare = totalFee.multiply(result.closedQuantity()).divide(quantity, MathContext.DECIMAL64);
        return result.realized().subtract(feeShare, MathContext.DECIMAL64);
    }

    /**
     * Sort key: the entry timestamp, else the date and time cells read as UTC (time defaults
     * to midnight), else the epoch.
     */
    static Instant orderingInstant(PartialTrade trade) {
        if (trade.hasTimestamp()) {
            return trade.getEntryTimestamp();
        }
        String date = trade.getDate();
        if (date != null && !date.isEmpty()) {
            String time = trade.getTime() == null || trade.getTime().isEmpty() ? "00:00" : trade.getTime();
            String normalized = time.length() == 5 ? time + ":00" : time;
            try {
                return LocalDateTime.parse(date + "T" + normalized).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                log.trace("Unsortable row time, ordering as epoch: date={}, time={}", date, time);
            }
        }
        return Instant.EPOCH;
    }
}

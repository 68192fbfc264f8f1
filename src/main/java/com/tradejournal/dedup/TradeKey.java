package com.tradejournal.dedup;

import com.tradejournal.domain.model.PartialTrade;
import com.tradejournal.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Equality fingerprint of a trade's normalized fields.
 *
 * <p>Fields are joined with '|' in a fixed order: entry instant (ISO-8601, millisecond
 * precision, UTC), ticker, side, type, quantity, P&amp;L and change. Text fields are lower-cased;
 * numbers are written with four decimals. Absent values contribute an empty segment.
 * Keys are computed on demand and never stored.
 */
public final class TradeKey {

    private static final String DELIMITER = "|";

    private static final DateTimeFormatter INSTANT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private TradeKey() {}

    public static String of(PartialTrade trade) {
        return of(
                trade.getEntryTimestamp(),
                trade.getTicker(),
                trade.getSide(),
                trade.getType(),
                trade.getQuantity(),
                trade.getPnl(),
                trade.getChange());
    }

    public static String of(TradeRecord record) {
        return of(
                record.getEntryTimestamp(),
                record.getTicker(),
                record.getSide(),
                record.getType(),
                record.getQuantity(),
                record.getPnl(),
                record.getChange());
    }

    public static String of(
            Instant entryTimestamp,
            String ticker,
            String side,
            String type,
            BigDecimal quantity,
            BigDecimal pnl,
            String change) {
        return String.join(
                DELIMITER,
                entryTimestamp == null ? "" : INSTANT_FORMAT.format(entryTimestamp),
                lower(ticker),
                lower(side),
                lower(type),
                fourPlaces(quantity),
                fourPlaces(pnl),
                lower(change));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String fourPlaces(BigDecimal value) {
        return value == null ? "" : value.setScale(4, RoundingMode.HALF_UP).toPlainString();
    }
}

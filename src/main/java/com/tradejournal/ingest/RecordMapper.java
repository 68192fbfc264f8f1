package com.tradejournal.ingest;

import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.model.MappedRow;
import com.tradejournal.domain.model.PartialTrade;
import com.tradejournal.domain.model.RowMeta;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw statement rows into partial trades plus the fill metadata reconciliation needs.
 *
 * <p>Rows carrying nothing recognisable (no timestamp, ticker, side, type, status, quantity or
 * P&amp;L) are dropped. Nothing here throws on bad cell content; unreadable values are absent.
 */
@Component
public class RecordMapper {

    private static final Logger log = LoggerFactory.getLogger(RecordMapper.class);

    private final TimestampReconstructor timestampReconstructor;
    private final InstrumentNormalizer instrumentNormalizer;

    public RecordMapper(TimestampReconstructor timestampReconstructor, InstrumentNormalizer instrumentNormalizer) {
        this.timestampReconstructor = timestampReconstructor;
        this.instrumentNormalizer = instrumentNormalizer;
    }

    public List<MappedRow> mapAll(List<RawRecord> records) {
        List<MappedRow> mapped = new ArrayList<>(records.size());
        for (RawRecord record : records) {
            map(record).ifPresent(mapped::add);
        }
        if (mapped.size() < records.size()) {
            log.debug("Dropped empty statement rows: read={}, kept={}", records.size(), mapped.size());
        }
        return mapped;
    }

    /**
     * Maps one row, or returns empty when the row has no usable content.
     */
    public Optional<MappedRow> map(RawRecord record) {
        Instant entryTimestamp = timestampReconstructor.reconstruct(record).orElse(null);

        BigDecimal quantity = FieldResolver.resolve(record, StatementField.QUANTITY)
                .flatMap(CellValues::parseNumber)
                .map(BigDecimal::abs)
                .orElse(null);
        BigDecimal pnl = CellValues.parseNumber(pnlCell(record)).orElse(null);

        String ticker = CellValues.clip(instrumentNormalizer.normalize(
                FieldResolver.resolve(record, StatementField.TICKER).orElse("")));
        String side = CellValues.clip(TradeSide.normalize(
                FieldResolver.resolve(record, StatementField.SIDE).orElse("")));
        String type = CellValues.clip(FieldResolver.resolve(record, StatementField.TYPE).orElse(""));
        String change = CellValues.clip(FieldResolver.resolve(record, StatementField.CHANGE).orElse(""));

        BigDecimal fillPrice = FieldResolver.resolve(record, StatementField.FILL_PRICE)
                .flatMap(CellValues::parseNumber)
                .orElse(null);
        BigDecimal commission = FieldResolver.resolve(record, StatementField.COMMISSION)
                .flatMap(CellValues::parseNumber)
                .orElse(BigDecimal.ZERO);

        PartialTrade trade = PartialTrade.builder()
                .entryTimestamp(entryTimestamp)
                .date(entryTimestamp != null
                        ? TimestampReconstructor.formatDate(entryTimestamp)
                        : CellValues.clip(record.get("date").orElse("")))
                .time(entryTimestamp != null
                        ? TimestampReconstructor.formatTime(entryTimestamp)
                        : CellValues.clip(record.get("time").orElse("")))
                .side(side)
                .type(type)
                .ticker(ticker)
                .quantity(quantity)
                .pnl(pnl)
                .change(change)
                .build();

        if (!hasContent(trade)) {
            return Optional.empty();
        }

        RowMeta meta = RowMeta.builder()
                .side(side)
                .quantity(quantity)
                .fillPrice(fillPrice)
                .feePerUnit(feePerUnit(commission, quantity))
                .totalFee(commission)
                .multiplier(instrumentNormalizer.multiplierFor(ticker))
                .build();
        return Optional.of(new MappedRow(trade, meta));
    }

    /**
     * The P&amp;L cell: the first matching P&amp;L column, else the {@code change} column when the
     * file has one, else {@code status}.
     */
    private static String pnlCell(RawRecord record) {
        Optional<String> matched = FieldResolver.resolve(record, StatementField.PNL);
        if (matched.isPresent()) {
            return matched.get();
        }
        if (record.hasColumn("change")) {
            return record.raw("change");
        }
        return record.raw("status");
    }

    private static BigDecimal feePerUnit(BigDecimal commission, BigDecimal quantity) {
        if (quantity == null || quantity.signum() == 0 || commission.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return commission.divide(quantity, MathContext.DECIMAL64);
    }

    private static boolean hasContent(PartialTrade trade) {
        return trade.hasTimestamp()
                || !trade.getTicker().isEmpty()
                || !trade.getSide().isEmpty()
                || !trade.getType().isEmpty()
                || !trade.getChange().isEmpty()
                || trade.hasQuantity()
                || trade.hasPnl();
    }
}

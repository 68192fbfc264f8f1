package com.tradejournal.service;

import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.repository.TradeRecordStore;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.springframework.stereotype.Service;

/**
 * Read access to stored trades for journal views.
 */
@Service
public class TradeRecordService {

    private static final BigDecimal ZERO_PNL_TOLERANCE = new BigDecimal("0.000001");

    private final TradeRecordStore tradeRecordStore;

    public TradeRecordService(TradeRecordStore tradeRecordStore) {
        this.tradeRecordStore = tradeRecordStore;
    }

    /**
     * Trades of {@code ownerId}, newest first.
     *
     * @param account           restricts to one source account when not blank
     * @param side              restricts to "Long" or "Short" when it names a side
     * @param hideFilledZeroPnl drops order-fill rows ("filled" status) that carry no P&amp;L
     */
    public List<TradeRecord> listTrades(String ownerId, String account, String side, boolean hideFilledZeroPnl) {
        Optional<TradeSide> sideFilter = TradeSide.parse(side);
        Stream<TradeRecord> trades = tradeRecordStore.findByOwner(ownerId).stream();
        if (account != null && !account.isBlank()) {
            trades = trades.filter(trade -> account.equals(trade.getSourceAccount()));
        }
        if (sideFilter.isPresent()) {
            trades = trades.filter(trade -> sideFilter.get().getLabel().equals(trade.getSide()));
        }
        if (hideFilledZeroPnl) {
            trades = trades.filter(trade -> !isFilledWithZeroPnl(trade));
        }
        return trades.toList();
    }

    static boolean isFilledWithZeroPnl(TradeRecord trade) {
        String status = trade.getChange() == null ? "" : trade.getChange().trim().toLowerCase(Locale.ROOT);
        BigDecimal pnl = trade.getPnl() == null ? BigDecimal.ZERO : trade.getPnl();
        return "filled".equals(status) && pnl.abs().compareTo(ZERO_PNL_TOLERANCE) < 0;
    }
}

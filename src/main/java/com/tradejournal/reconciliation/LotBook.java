package com.tradejournal.reconciliation;

import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.model.Lot;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Open long and short lots per ticker, oldest first.
 *
 * <p>A ticker never holds open lots on both sides at once: an incoming fill consumes the
 * opposite side before anything is opened on its own side.
 */
public class LotBook {

    private final Map<String, Deque<Lot>> longLots = new HashMap<>();
    private final Map<String, Deque<Lot>> shortLots = new HashMap<>();

    /** Outcome of closing against the opposite side. */
    record CloseResult(BigDecimal realized, BigDecimal closedQuantity, BigDecimal remaining) {}

    /**
     * Consumes lots on the side opposite to {@code incoming}, oldest first, at {@code exitPrice}.
     *
     * <p>Each matched unit realizes the price move times the lot's multiplier, less the lot's own
     * per-unit entry fee.
     */
    CloseResult close(String ticker, TradeSide incoming, BigDecimal quantity, BigDecimal exitPrice) {
        Map<String, Deque<Lot>> oppositeBook = incoming == TradeSide.LONG ? shortLots : longLots;
        boolean closingLong = incoming == TradeSide.SHORT;
        Deque<Lot> queue = oppositeBook.get(ticker);

        BigDecimal realized = BigDecimal.ZERO;
        BigDecimal remaining = quantity;
        while (remaining.signum() > 0 && queue != null && !queue.isEmpty()) {
            Lot lot = queue.peekFirst();
            BigDecimal matched = lot.take(remaining);
            BigDecimal priceDelta =
                    closingLong ? exitPrice.subtract(lot.getPrice()) : lot.getPrice().subtract(exitPrice);
            realized = realized
                    .add(priceDelta.multiply(matched).multiply(lot.getMultiplier()), MathContext.DECIMAL64)
                    .subtract(lot.getFeePerUnit().multiply(matched), MathContext.DECIMAL64);
            if (lot.isEmpty()) {
                queue.pollFirst();
            }
            remaining = remaining.subtract(matched);
        }
        if (queue != null && queue.isEmpty()) {
            oppositeBook.remove(ticker);
        }
        return new CloseResult(realized, quantity.subtract(remaining), remaining);
    }

    void open(String ticker, TradeSide side, Lot lot) {
        Map<String, Deque<Lot>> book = side == TradeSide.LONG ? longLots : shortLots;
        book.computeIfAbsent(ticker, key -> new ArrayDeque<>()).addLast(lot);
    }

    /** Lots still open for {@code ticker} on {@code side}, oldest first. */
    public List<Lot> openLots(String ticker, TradeSide side) {
        Deque<Lot> queue = (side == TradeSide.LONG ? longLots : shortLots).get(ticker);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    public BigDecimal openQuantity(String ticker, TradeSide side) {
        return openLots(ticker, side).stream().map(Lot::getQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}

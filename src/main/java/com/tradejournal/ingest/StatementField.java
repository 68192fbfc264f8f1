package com.tradejournal.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered column matchers for every logical field a statement row can provide.
 *
 * <p>Order is priority: the first matcher that finds a non-blank cell wins, regardless of where
 * that column sits in the file. Supporting a new broker's spelling means adding an entry here.
 */
public enum StatementField {
    QUANTITY(
            ColumnMatcher.exactly("qty", "quantity", "contracts", "shares", "size", "filledqty", "filled_qty"),
            ColumnMatcher.pattern("(^|_)(qty|quantity|contracts?|shares?)($|_)")),
    PNL(
            ColumnMatcher.exactly(
                    "pnl",
                    "p_l",
                    "pl",
                    "net_profit",
                    "gross_profit",
                    "realized_pnl",
                    "realized_pl",
                    "net_pnl",
                    "pnl_usd",
                    "p_l_usd",
                    "profit",
                    "profit_loss"),
            ColumnMatcher.pattern("(^|_)pnl($|_)"),
            ColumnMatcher.pattern("(^|_)p_l($|_)"),
            ColumnMatcher.pattern("(^|_)profit($|_)")),
    CHANGE(ColumnMatcher.exactly("change", "status", "result"), ColumnMatcher.where(column -> column.endsWith("_status"))),
    TICKER(ColumnMatcher.exactly("ticker", "symbol", "instrument", "product", "contract", "product_description")),
    SIDE(ColumnMatcher.exactly("side", "b_s", "buy_sell", "order_action")),
    TYPE(ColumnMatcher.exactly("type", "asset_type", "product")),
    FILL_PRICE(ColumnMatcher.exactly(
            "fill_price",
            "fillprice",
            "price",
            "execution_price",
            "_price",
            "avgprice",
            "avg_fill_price",
            "decimalfillavg")),
    COMMISSION(ColumnMatcher.exactly("commission", "fee", "fees"));

    private final List<ColumnMatcher> matchers;

    StatementField(List<ColumnMatcher> exactNames, ColumnMatcher... fallbacks) {
        List<ColumnMatcher> all = new ArrayList<>(exactNames);
        all.addAll(List.of(fallbacks));
        this.matchers = List.copyOf(all);
    }

    public List<ColumnMatcher> matchers() {
        return matchers;
    }
}

package com.tradejournal.domain.enums;

/** Vocabulary a broker uses in its side column. Documentation only: both map onto {@link TradeSide}. */
public enum SideConvention {
    BUY_SELL,
    LONG_SHORT
}

package com.tradejournal.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A mapped statement row: the trade being built plus the reconciliation facts behind it. */
@Getter
@AllArgsConstructor
public class MappedRow {

    private final PartialTrade trade;
    private final RowMeta meta;
}

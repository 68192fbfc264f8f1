package com.tradejournal.domain.model;

import lombok.Builder;
import lombok.Getter;

/** One documented column of a broker's CSV export. */
@Getter
@Builder
public class SchemaColumn {

    private final String label;
    private final String description;
    private final boolean required;
    private final String sample;

    /** Trade record field the column feeds, or null when it is informational. */
    private final String mapsTo;
}

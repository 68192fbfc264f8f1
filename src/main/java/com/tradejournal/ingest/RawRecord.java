package com.tradejournal.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One CSV data row keyed by normalized column name, in header order.
 *
 * <p>Values are trimmed. A blank cell and a missing column both read as absent through
 * {@link #get(String)}; {@link #hasColumn(String)} tells them apart.
 */
public final class RawRecord {

    private final Map<String, String> values;

    private RawRecord(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Pairs normalized headers with a row's cells. Missing trailing cells become empty;
     * surplus cells are ignored. A repeated header keeps its first position and last value.
     */
    public static RawRecord of(List<String> headers, List<String> cells) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String cell = i < cells.size() && cells.get(i) != null ? cells.get(i).trim() : "";
            values.put(headers.get(i), cell);
        }
        return new RawRecord(values);
    }

    public static RawRecord of(Map<String, String> values) {
        Map<String, String> trimmed = new LinkedHashMap<>();
        values.forEach((column, value) -> trimmed.put(column, value == null ? "" : value.trim()));
        return new RawRecord(trimmed);
    }

    /** Column names in header order. */
    public Set<String> columns() {
        return values.keySet();
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    /** The cell under {@code column} when it exists and is not blank. */
    public Optional<String> get(String column) {
        String value = values.get(column);
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    /** The cell under {@code column} as stored, possibly empty; null when the column does not exist. */
    public String raw(String column) {
        return values.get(column);
    }

    @Override
    public String toString() {
        return "RawRecord" + values;
    }
}

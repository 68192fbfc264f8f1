package com.tradejournal.ingest;

import com.tradejournal.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient helpers for statement cells: numbers such as "$1,234.50", "49,152.00 USD" or "-3",
 * and text cut to what a trade record stores.
 */
public final class CellValues {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]");

    private CellValues() {}

    /**
     * Keeps digits, '.' and '-' and parses what is left. Empty or malformed leftovers are absent.
     */
    public static Optional<BigDecimal> parseNumber(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        String cleaned = NON_NUMERIC.matcher(value).replaceAll("");
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Cuts text longer than {@link TradeRecord#MAX_TEXT_LENGTH}. */
    public static String clip(String value) {
        if (value == null || value.length() <= TradeRecord.MAX_TEXT_LENGTH) {
            return value;
        }
        return value.substring(0, TradeRecord.MAX_TEXT_LENGTH);
    }
}

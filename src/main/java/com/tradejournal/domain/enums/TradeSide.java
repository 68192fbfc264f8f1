package com.tradejournal.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Canonical trade direction. "buy"/"long" map to LONG and "sell"/"short" to SHORT, case-insensitively.
 */
public enum TradeSide {
    LONG("Long"),
    SHORT("Short");

    private final String label;

    TradeSide(String label) {
        this.label = label;
    }

    /** Display label stored on trade records ("Long" / "Short"). */
    public String getLabel() {
        return label;
    }

    public static Optional<TradeSide> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "buy", "long" -> Optional.of(LONG);
            case "sell", "short" -> Optional.of(SHORT);
            default -> Optional.empty();
        };
    }

    /**
     * Returns the canonical label for a recognised side, otherwise the value unchanged.
     * Null becomes the empty string.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return parse(value).map(TradeSide::getLabel).orElse(value);
    }
}

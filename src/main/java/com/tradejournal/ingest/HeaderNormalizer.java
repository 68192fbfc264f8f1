package com.tradejournal.ingest;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes CSV header names so broker-specific spellings compare equal.
 *
 * <p>"Fill Price", "fill-price" and " Fill  Price " all become {@code fill_price}; a leading
 * byte-order mark is dropped.
 */
public final class HeaderNormalizer {

    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final Pattern NON_ALPHANUMERIC_RUN = Pattern.compile("[^a-z0-9]+");

    private HeaderNormalizer() {}

    public static String normalize(String header) {
        if (header == null) {
            return "";
        }
        String value = header.startsWith(BYTE_ORDER_MARK) ? header.substring(1) : header;
        String lower = value.trim().toLowerCase(Locale.ROOT);
        return NON_ALPHANUMERIC_RUN.matcher(lower).replaceAll("_");
    }
}

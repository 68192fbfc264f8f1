package com.tradejournal.ingest;

import java.util.List;
import java.util.Optional;

/**
 * Extracts one logical field from a raw record using an ordered list of column matchers.
 *
 * <p>Matcher priority outranks column order: every column is tested against the first matcher
 * before the second matcher is consulted. Absence is not an error.
 */
public final class FieldResolver {

    private FieldResolver() {}

    public static Optional<String> resolve(RawRecord record, StatementField field) {
        return resolve(record, field.matchers());
    }

    public static Optional<String> resolve(RawRecord record, List<ColumnMatcher> matchers) {
        for (ColumnMatcher matcher : matchers) {
            for (String column : record.columns()) {
                if (!matcher.matches(column)) {
                    continue;
                }
                Optional<String> value = record.get(column);
                if (value.isPresent()) {
                    return value;
                }
            }
        }
        return Optional.empty();
    }
}

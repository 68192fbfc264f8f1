package com.tradejournal.ingest;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides whether a normalized column name can hold a given logical field.
 */
@FunctionalInterface
public interface ColumnMatcher {

    boolean matches(String column);

    static ColumnMatcher exact(String name) {
        return column -> column.equals(name);
    }

    /** Matches when the regex is found anywhere in the column name. */
    static ColumnMatcher pattern(String regex) {
        Pattern compiled = Pattern.compile(regex);
        return column -> compiled.matcher(column).find();
    }

    static ColumnMatcher where(Predicate<String> predicate) {
        return predicate::test;
    }

    static List<ColumnMatcher> exactly(String... names) {
        return Arrays.stream(names).map(ColumnMatcher::exact).toList();
    }
}

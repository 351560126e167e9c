package com.fleetrun.core.expand;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a {@code column <op> value} expression into a row predicate.
 *
 * <p>Supported operators: {@code = != > < >= <=}. Equality compares strings,
 * the ordering operators compare numbers and never match a non-numeric cell.
 * The value may be wrapped in single or double quotes.
 * A malformed expression compiles to a predicate that accepts every row.
 */
public final class RowFilter {

    private static final Logger log = LoggerFactory.getLogger(RowFilter.class);

    static final Pattern EXPRESSION = Pattern.compile("^\\s*(\\w+)\\s*(!=|>=|<=|=|>|<)\\s*(.+?)\\s*$");

    private static final Predicate<Map<String, String>> ACCEPT_ALL = row -> true;

    private RowFilter() {}

    public static Predicate<Map<String, String>> compile(String expression) {
        if (expression == null || expression.isBlank()) {
            return ACCEPT_ALL;
        }
        Matcher m = EXPRESSION.matcher(expression);
        if (!m.matches()) {
            log.warn("Invalid filter expression '{}', all rows will be used", expression);
            return ACCEPT_ALL;
        }
        String column = m.group(1);
        String operator = m.group(2);
        String value = unquote(m.group(3));

        return switch (operator) {
            case "=" -> row -> cell(row, column).equals(value);
            case "!=" -> row -> !cell(row, column).equals(value);
            case ">" -> row -> compare(cell(row, column), value, c -> c > 0);
            case "<" -> row -> compare(cell(row, column), value, c -> c < 0);
            case ">=" -> row -> compare(cell(row, column), value, c -> c >= 0);
            case "<=" -> row -> compare(cell(row, column), value, c -> c <= 0);
            default -> ACCEPT_ALL;
        };
    }

    private static String cell(Map<String, String> row, String column) {
        String v = row.get(column);
        return v != null ? v : "";
    }

    private static boolean compare(String cell, String value, java.util.function.IntPredicate test) {
        BigDecimal left = toNumber(cell);
        BigDecimal right = toNumber(value);
        if (left == null || right == null) {
            return false;
        }
        return test.test(left.compareTo(right));
    }

    private static BigDecimal toNumber(String s) {
        try {
            return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String unquote(String raw) {
        if (raw.length() >= 2) {
            char first = raw.charAt(0);
            char last = raw.charAt(raw.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        return raw;
    }
}

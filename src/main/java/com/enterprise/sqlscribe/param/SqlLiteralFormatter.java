package com.enterprise.sqlscribe.param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Converts typed Java values to SQL literals for inline use.
 * Values passed through this formatter appear directly in SQL text.
 */
public final class SqlLiteralFormatter {

    private SqlLiteralFormatter() {}

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Checks that {@link #format} accepts the value, so a bad literal fails
     * where it is created rather than when the statement is rendered.
     *
     * @return the value itself
     */
    public static Object requireSupported(Object value) {
        format(value);
        return value;
    }

    /**
     * Formats a Java value as a SQL literal.
     *
     * @throws NullPointerException     if value is null
     * @throws IllegalArgumentException if the type is not supported
     */
    public static String format(Object value) {
        Objects.requireNonNull(value, "literal value must not be null");

        if (value instanceof String s) {
            return "'" + s.replace("'", "''") + "'";
        }
        if (value instanceof Character c) {
            return format(String.valueOf(c));
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Double d && !Double.isFinite(d)
                || value instanceof Float f && !Float.isFinite(f)) {
            throw new IllegalArgumentException("Non-finite number has no SQL literal: " + value);
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof LocalDate ld) {
            return "DATE '" + ld + "'";
        }
        if (value instanceof LocalDateTime ldt) {
            return "TIMESTAMP '" + TIMESTAMP.format(ldt) + "'";
        }

        throw new IllegalArgumentException(
                "Unsupported literal type: " + value.getClass().getName());
    }
}

package com.enterprise.querybuilder.sql.param;

import com.enterprise.querybuilder.sql.core.SqlDialect;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.Temporal;
import java.util.HexFormat;

/**
 * Converts normalized values to SQL literals for inline use.
 * Values passed through this formatter appear directly in SQL text
 * (not as bind parameters).
 */
public final class SqlLiteralFormatter {

    static final DateTimeFormatter OFFSET_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");
    static final DateTimeFormatter LOCAL_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private SqlLiteralFormatter() {}

    /**
     * Formats a value as a literal. {@code null} renders as {@code NULL};
     * strings are enclosed and escaped with the dialect's characters.
     */
    public static String format(Scalar value, SqlDialect dialect) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Scalar.Text t) {
            return dialect.quote(t.value());
        }
        if (value instanceof DbString s) {
            return dialect.quote(s.value());
        }
        if (value instanceof Scalar.Timestamp ts) {
            return dialect.quote(formatTemporal(ts.value()));
        }
        if (value instanceof Scalar.Bytes b) {
            return "X'" + HexFormat.of().withUpperCase().formatHex(b.value()) + "'";
        }
        return formatUnquoted(value);
    }

    /**
     * Formats a raw fragment: text as-is, numbers and booleans formatted.
     *
     * @throws IllegalArgumentException for timestamps and byte arrays
     */
    public static String formatRaw(Scalar value) {
        if (value instanceof Scalar.Text t) {
            return t.value();
        }
        if (value instanceof DbString s) {
            return s.value();
        }
        if (!isRawRenderable(value)) {
            throw new IllegalArgumentException(
                    "Raw fragment must be textual, got " + value.getClass().getSimpleName());
        }
        return formatUnquoted(value);
    }

    public static boolean isRawRenderable(Scalar value) {
        return value.isTextual()
                || value instanceof Scalar.Int
                || value instanceof Scalar.Real
                || value instanceof Scalar.Decimal
                || value instanceof Scalar.Bool;
    }

    private static String formatUnquoted(Scalar value) {
        if (value instanceof Scalar.Int i) {
            return Long.toString(i.value().longValue());
        }
        if (value instanceof Scalar.Decimal d) {
            return d.value().toPlainString();
        }
        if (value instanceof Scalar.Real r) {
            return formatReal(r.value());
        }
        if (value instanceof Scalar.Bool b) {
            return b.value() ? "1" : "0";
        }
        throw new IllegalArgumentException(
                "Unsupported literal type: " + value.getClass().getName());
    }

    // 1E+3 renders as 1000, not scientific notation
    private static String formatReal(Number n) {
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return "'" + d + "'";
        }
        if (n instanceof Float f) {
            return new BigDecimal(Float.toString(f)).toPlainString();
        }
        return BigDecimal.valueOf(d).toPlainString();
    }

    static String formatTemporal(Temporal t) {
        if (t instanceof OffsetDateTime odt) {
            return OFFSET_TIMESTAMP.format(odt);
        }
        if (t instanceof LocalDateTime ldt) {
            return LOCAL_TIMESTAMP.format(ldt);
        }
        if (t instanceof LocalDate ld) {
            return DATE.format(ld);
        }
        return t.toString();
    }
}

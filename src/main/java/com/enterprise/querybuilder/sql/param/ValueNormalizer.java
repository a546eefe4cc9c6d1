package com.enterprise.querybuilder.sql.param;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Reduces a caller-supplied value to a {@link Scalar}, or to {@code null}
 * when there is no usable value.
 *
 * <p>Absent: {@code null}, empty optionals and anything that is not one of the
 * recognized kinds. A present {@link Optional} (or primitive optional) is
 * unwrapped exactly once; an optional nested in an optional is absent.
 *
 * <p>Recognized kinds: {@code String}, {@code Byte}, {@code Short},
 * {@code Integer}, {@code Long}, {@code Float}, {@code Double},
 * {@code Boolean}, {@code byte[]}, {@code BigDecimal}, {@code LocalDate},
 * {@code LocalDateTime}, {@code OffsetDateTime}, {@code ZonedDateTime},
 * {@code Instant}, {@code java.util.Date} (and its {@code java.sql}
 * subclasses), {@link DbString} and any {@link Scalar}.
 */
public final class ValueNormalizer {

    private ValueNormalizer() {}

    public static Scalar normalize(Object value) {
        if (value instanceof Optional<?> opt) {
            return opt.map(ValueNormalizer::classify).orElse(null);
        }
        if (value instanceof OptionalInt oi) {
            return oi.isPresent() ? new Scalar.Int(oi.getAsInt()) : null;
        }
        if (value instanceof OptionalLong ol) {
            return ol.isPresent() ? new Scalar.Int(ol.getAsLong()) : null;
        }
        if (value instanceof OptionalDouble od) {
            return od.isPresent() ? new Scalar.Real(od.getAsDouble()) : null;
        }
        return classify(value);
    }

    public static boolean isAbsent(Object value) {
        return normalize(value) == null;
    }

    private static Scalar classify(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Scalar s) {
            return s;
        }
        if (value instanceof String s) {
            return new Scalar.Text(s);
        }
        if (value instanceof Byte || value instanceof Short
                || value instanceof Integer || value instanceof Long) {
            return new Scalar.Int((Number) value);
        }
        if (value instanceof Float || value instanceof Double) {
            return new Scalar.Real((Number) value);
        }
        if (value instanceof Boolean b) {
            return new Scalar.Bool(b);
        }
        if (value instanceof BigDecimal bd) {
            return new Scalar.Decimal(bd);
        }
        if (value instanceof byte[] bytes) {
            return new Scalar.Bytes(bytes);
        }
        if (value instanceof LocalDate || value instanceof LocalDateTime
                || value instanceof OffsetDateTime) {
            return new Scalar.Timestamp((java.time.temporal.Temporal) value);
        }
        if (value instanceof ZonedDateTime zdt) {
            return new Scalar.Timestamp(zdt.toOffsetDateTime());
        }
        if (value instanceof Instant instant) {
            return new Scalar.Timestamp(instant.atOffset(ZoneOffset.UTC));
        }
        if (value instanceof Date date) {
            return new Scalar.Timestamp(fromLegacyDate(date));
        }
        return null;
    }

    // java.sql.Date and java.sql.Time do not support toInstant()
    private static java.time.temporal.Temporal fromLegacyDate(Date date) {
        if (date instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate();
        }
        if (date instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (date instanceof java.sql.Time time) {
            return LocalDate.EPOCH.atTime(time.toLocalTime());
        }
        return date.toInstant().atOffset(ZoneOffset.UTC);
    }
}

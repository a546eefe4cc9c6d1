package com.enterprise.querybuilder.sql.param;

import java.math.BigDecimal;
import java.time.temporal.Temporal;
import java.util.Arrays;
import java.util.Objects;

/**
 * A normalized, concretely typed value. "No value" is represented by
 * {@code null} and never by a {@code Scalar} instance.
 *
 * <p>Equality is structural within a kind: integers compare by numeric value
 * regardless of width ({@code 0 == 0L}), decimals ignore scale, byte arrays
 * compare by content. Values of different kinds are never equal.
 *
 * @see ValueNormalizer
 */
public sealed interface Scalar
        permits Scalar.Text, Scalar.Int, Scalar.Real, Scalar.Bool,
                Scalar.Timestamp, Scalar.Bytes, Scalar.Decimal, DbString {

    /** The plain Java value, suitable for a prepared statement. */
    Object value();

    /** True for values that may be emitted verbatim as an SQL fragment. */
    default boolean isTextual() {
        return false;
    }

    record Text(String value) implements Scalar {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isTextual() {
            return true;
        }
    }

    /** Byte, Short, Integer or Long. */
    record Int(Number value) implements Scalar {
        public Int {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Int other && value.longValue() == other.value.longValue();
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value.longValue());
        }
    }

    /** Float or Double. */
    record Real(Number value) implements Scalar {
        public Real {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Real other
                    && Double.compare(value.doubleValue(), other.value.doubleValue()) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value.doubleValue());
        }
    }

    record Bool(Boolean value) implements Scalar {
        public Bool {
            Objects.requireNonNull(value, "value");
        }
    }

    /** LocalDate, LocalDateTime or OffsetDateTime. */
    record Timestamp(Temporal value) implements Scalar {
        public Timestamp {
            Objects.requireNonNull(value, "value");
        }
    }

    record Bytes(byte[] value) implements Scalar {
        public Bytes {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Bytes[length=" + value.length + "]";
        }
    }

    record Decimal(BigDecimal value) implements Scalar {
        public Decimal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Decimal other && value.compareTo(other.value) == 0;
        }

        @Override
        public int hashCode() {
            return value.stripTrailingZeros().hashCode();
        }
    }
}

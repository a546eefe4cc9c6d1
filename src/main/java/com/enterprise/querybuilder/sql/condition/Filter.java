package com.enterprise.querybuilder.sql.condition;

import java.util.Objects;

/**
 * One WHERE predicate.
 * <ul>
 *   <li>{@link #equalTo}: {@code expr = ?} with a value, {@code expr IS NULL} without</li>
 *   <li>{@link #expression}: emitted verbatim, never bound</li>
 * </ul>
 * The value is kept as supplied and normalized at build time.
 */
public record Filter(String expression, Object value, boolean expressionOnly) {

    public Filter {
        Objects.requireNonNull(expression, "expression");
    }

    public static Filter equalTo(String column, Object value) {
        return new Filter(column, value, false);
    }

    public static Filter expression(String expression) {
        return new Filter(expression, null, true);
    }
}

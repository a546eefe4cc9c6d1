package com.enterprise.querybuilder.sql.core;

import java.util.Objects;

/**
 * Engine-specific settings consumed by the assembler: how strings are quoted
 * and escaped, how reserved words are escaped, what the parameter placeholder
 * looks like and where the row limit goes.
 *
 * <p>With {@code parameterInSequence} the placeholder is suffixed with a
 * running number ({@code @p1, @p2} or {@code $1, $2}); otherwise the bare
 * token is repeated ({@code ?, ?}).
 *
 * @see Dialects
 */
public record SqlDialect(
        String stringEnclosingChar,
        String stringEscapeChar,
        String reservedWordEscapeChars,
        String parameterPlaceholder,
        boolean parameterInSequence,
        LimitPosition limitPosition) {

    public SqlDialect {
        Objects.requireNonNull(stringEnclosingChar, "stringEnclosingChar");
        Objects.requireNonNull(stringEscapeChar, "stringEscapeChar");
        Objects.requireNonNull(reservedWordEscapeChars, "reservedWordEscapeChars");
        Objects.requireNonNull(parameterPlaceholder, "parameterPlaceholder");
        Objects.requireNonNull(limitPosition, "limitPosition");
        if (parameterPlaceholder.isBlank()) {
            throw new IllegalArgumentException("parameterPlaceholder must not be blank");
        }
        if (stringEnclosingChar.isEmpty()) {
            throw new IllegalArgumentException("stringEnclosingChar must not be empty");
        }
    }

    /**
     * Placeholder for the given position. The position is ignored when the
     * dialect does not number its placeholders.
     */
    public String placeholder(int position) {
        return parameterInSequence ? parameterPlaceholder + position : parameterPlaceholder;
    }

    /** Front-positioned limit, e.g. {@code TOP 10}. */
    public String top(String limit) {
        return "TOP " + limit;
    }

    /** Rear-positioned limit, e.g. {@code LIMIT 10}. */
    public String limit(String limit) {
        return "LIMIT " + limit;
    }

    /**
     * Escapes every enclosing char inside {@code value} by prefixing it with
     * the escape char. The result still has to be enclosed by the caller.
     */
    public String escape(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return value.replace(stringEnclosingChar, stringEscapeChar + stringEnclosingChar);
    }

    /** Escapes and encloses a string value: {@code it's -> 'it\'s'}. */
    public String quote(String value) {
        return stringEnclosingChar + escape(value) + stringEnclosingChar;
    }

    /**
     * Opening and closing reserved-word escape chars. A single char is used
     * for both sides, two chars are split ({@code []}), anything empty falls
     * back to double quotes.
     */
    public String[] reservedWordEscapes() {
        String ec = reservedWordEscapeChars;
        if (ec.length() == 1) {
            return new String[] {ec, ec};
        }
        if (ec.length() >= 2) {
            return new String[] {ec.substring(0, 1), ec.substring(1, 2)};
        }
        return new String[] {"\"", "\""};
    }

    /** Wraps an identifier in the reserved-word escape pair: {@code [Order]}. */
    public String quoteIdentifier(String identifier) {
        String[] pair = reservedWordEscapes();
        return pair[0] + identifier + pair[1];
    }

    public SqlDialect withParameterPlaceholder(String placeholder, boolean inSequence) {
        return new SqlDialect(stringEnclosingChar, stringEscapeChar, reservedWordEscapeChars,
                placeholder, inSequence, limitPosition);
    }

    public SqlDialect withLimitPosition(LimitPosition position) {
        return new SqlDialect(stringEnclosingChar, stringEscapeChar, reservedWordEscapeChars,
                parameterPlaceholder, parameterInSequence, position);
    }
}

package com.enterprise.querybuilder.sql.builder;

/**
 * How a column value is rendered.
 *
 * <ul>
 *   <li>{@code bound}: bound as a placeholder (literal mode: quoted literal).
 *       When false the value is a raw SQL fragment such as {@code GETDATE()}.</li>
 *   <li>{@code defaultValue}: used when the value is absent.</li>
 *   <li>{@code matchToNull}: when equal to the effective value, the column is
 *       written as {@code NULL}.</li>
 * </ul>
 *
 * <pre>{@code
 * builder.addValue("Birthdate", "GETDATE()", ValueOptions.raw());
 * builder.addValue("TraderKey", key, ValueOptions.parameter().withMatchToNull(0));
 * }</pre>
 */
public record ValueOptions(boolean bound, Object defaultValue, Object matchToNull) {

    private static final ValueOptions PARAMETER = new ValueOptions(true, null, null);
    private static final ValueOptions RAW = new ValueOptions(false, null, null);

    public static ValueOptions parameter() {
        return PARAMETER;
    }

    public static ValueOptions raw() {
        return RAW;
    }

    public ValueOptions withDefault(Object value) {
        return new ValueOptions(bound, value, matchToNull);
    }

    public ValueOptions withMatchToNull(Object value) {
        return new ValueOptions(bound, defaultValue, value);
    }

    public ValueOptions asParameter(boolean indeed) {
        return new ValueOptions(indeed, defaultValue, matchToNull);
    }
}

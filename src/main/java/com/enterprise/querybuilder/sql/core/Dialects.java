package com.enterprise.querybuilder.sql.core;

import java.util.Locale;

public final class Dialects {

    private Dialects() {}

    /** Engine-neutral defaults: {@code ?} placeholders, backslash escape, LIMIT at the end. */
    public static final SqlDialect DEFAULT =
            new SqlDialect("'", "\\", "\"", "?", false, LimitPosition.REAR);

    public static final SqlDialect SQL_SERVER =
            new SqlDialect("'", "'", "[]", "@p", true, LimitPosition.FRONT);

    public static final SqlDialect POSTGRES =
            new SqlDialect("'", "'", "\"", "$", true, LimitPosition.REAR);

    public static final SqlDialect MYSQL =
            new SqlDialect("'", "\\", "`", "?", false, LimitPosition.REAR);

    /**
     * Looks up a preset by name ({@code default}, {@code sqlserver},
     * {@code postgres}, {@code mysql}); case and dashes/underscores are ignored.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SqlDialect named(String name) {
        String key = name.toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        return switch (key) {
            case "default", "ansi" -> DEFAULT;
            case "sqlserver", "mssql" -> SQL_SERVER;
            case "postgres", "postgresql" -> POSTGRES;
            case "mysql", "mariadb" -> MYSQL;
            default -> throw new IllegalArgumentException("Unknown dialect: " + name);
        };
    }
}

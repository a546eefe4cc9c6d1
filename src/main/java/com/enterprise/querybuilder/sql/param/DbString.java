package com.enterprise.querybuilder.sql.param;

import java.util.Objects;

/**
 * A string tagged with the database column type it is meant for. Passed in as
 * a value it normalizes to itself; drivers receive the plain text.
 */
public record DbString(Kind kind, String value) implements Scalar {

    public enum Kind {
        VARCHAR,
        VARCHAR_MAX,
        NVARCHAR_MAX
    }

    public DbString {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    public static DbString varChar(String value) {
        return new DbString(Kind.VARCHAR, value);
    }

    public static DbString varCharMax(String value) {
        return new DbString(Kind.VARCHAR_MAX, value);
    }

    public static DbString nVarCharMax(String value) {
        return new DbString(Kind.NVARCHAR_MAX, value);
    }

    @Override
    public boolean isTextual() {
        return true;
    }
}

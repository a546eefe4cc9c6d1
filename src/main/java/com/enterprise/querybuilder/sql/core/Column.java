package com.enterprise.querybuilder.sql.core;

import java.util.Locale;
import java.util.Objects;

/**
 * A column registered on a builder. The length is advisory metadata only.
 * Two columns are the same column when their names match ignoring case.
 */
public final class Column {

    private final String name;
    private final int length;

    public Column(String name, int length) {
        this.name = Objects.requireNonNull(name, "column name");
        this.length = length;
    }

    public String name() { return name; }

    public int length() { return length; }

    public boolean hasName(String other) {
        return name.equalsIgnoreCase(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Column other)) return false;
        return hasName(other.name);
    }

    @Override
    public int hashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return name + "(" + length + ")";
    }
}

package com.enterprise.querybuilder.sql.core;

/**
 * Where the row-limiting fragment goes. SQL Server puts {@code TOP n} right
 * after SELECT; most other engines append {@code LIMIT n} at the end.
 */
public enum LimitPosition {
    FRONT,
    REAR
}

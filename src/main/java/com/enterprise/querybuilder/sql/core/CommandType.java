package com.enterprise.querybuilder.sql.core;

public enum CommandType {
    SELECT,
    INSERT,
    UPDATE,
    DELETE;

    /** True for the commands that write column values (INSERT, UPDATE). */
    public boolean writesValues() {
        return this == INSERT || this == UPDATE;
    }

    /** True for the commands that accept a WHERE clause (SELECT, UPDATE, DELETE). */
    public boolean acceptsFilters() {
        return this != INSERT;
    }
}

package com.enterprise.querybuilder.sql.core;

public enum SortDirection {
    ASC,
    DESC
}

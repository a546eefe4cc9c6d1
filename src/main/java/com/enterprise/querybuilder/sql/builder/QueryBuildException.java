package com.enterprise.querybuilder.sql.builder;

/**
 * Raised by the build methods when the builder cannot produce a statement.
 * Always thrown before any text is produced; there is no partial result.
 */
public class QueryBuildException extends RuntimeException {

    public enum Reason {
        MISSING_SOURCE("table or view was not specified"),
        MISSING_COLUMNS("no columns were specified"),
        ORDERING_NOT_SUPPORTED("ORDER BY is only supported for SELECT"),
        GROUPING_NOT_SUPPORTED("GROUP BY is only supported for SELECT"),
        RAW_FRAGMENT_NOT_TEXTUAL("raw fragment value must be textual"),
        COUNT_REQUIRES_SELECT("count wrapping is only supported for SELECT"),
        CONTRIBUTOR_ARGUMENTS_IN_LITERAL_MODE("filter contributor returned arguments in literal mode");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Reason reason;

    public QueryBuildException(Reason reason) {
        super(reason.description());
        this.reason = reason;
    }

    public QueryBuildException(Reason reason, String detail) {
        super(reason.description() + ": " + detail);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}

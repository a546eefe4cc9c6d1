package com.enterprise.querybuilder.sql.builder;

import com.enterprise.querybuilder.sql.core.SqlDialect;
import com.enterprise.querybuilder.sql.param.SqlLiteralFormatter;
import com.enterprise.querybuilder.sql.param.ValueNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parameterized statement: SQL text plus its arguments, the i-th argument
 * belonging to the i-th placeholder in the text.
 */
public class BuildResult {

    private final String sql;
    private final List<Object> arguments;
    private final SqlDialect dialect;

    public BuildResult(String sql, List<Object> arguments, SqlDialect dialect) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.arguments = Objects.requireNonNull(arguments, "arguments");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public String sql() { return sql; }

    public List<Object> arguments() { return arguments; }

    public SqlDialect dialect() { return dialect; }

    /** Arguments as an array, for {@code JdbcTemplate.update(sql, args)}. */
    public Object[] values() {
        return arguments.toArray();
    }

    /**
     * Number of placeholder tokens in the text. Tokens inside string literals
     * (the dialect's enclosing char, escapes honoured) are not counted.
     */
    public int placeholderCount() {
        return placeholderSpans().size();
    }

    /** Returns the SQL with all arguments inlined as literals, for debugging. */
    public String toDebugString() {
        StringBuilder sb = new StringBuilder();
        int last = 0;
        int i = 0;
        for (int[] span : placeholderSpans()) {
            sb.append(sql, last, span[0]);
            if (i < arguments.size()) {
                sb.append(SqlLiteralFormatter.format(ValueNormalizer.normalize(arguments.get(i)), dialect));
            } else {
                sb.append(sql, span[0], span[1]);
            }
            last = span[1];
            i++;
        }
        return sb.append(sql, last, sql.length()).toString();
    }

    /**
     * Verifies that the text carries exactly one placeholder per argument.
     *
     * @throws IllegalStateException on a mismatch
     */
    public void verify() {
        int placeholders = placeholderCount();
        if (placeholders != arguments.size()) {
            throw new IllegalStateException("SQL has " + placeholders
                    + " placeholder(s) but " + arguments.size() + " argument(s) were bound");
        }
    }

    // [start, end) of each placeholder outside string literals
    private List<int[]> placeholderSpans() {
        String quote = dialect.stringEnclosingChar();
        String escape = dialect.stringEscapeChar();
        String token = dialect.parameterPlaceholder();
        List<int[]> spans = new ArrayList<>();
        boolean inLiteral = false;
        int i = 0;
        while (i < sql.length()) {
            if (inLiteral) {
                if (!escape.isEmpty() && !escape.equals(quote)
                        && sql.startsWith(escape, i) && sql.startsWith(quote, i + escape.length())) {
                    i += escape.length() + quote.length();
                } else if (sql.startsWith(quote, i)) {
                    // a doubled enclosing char closes and reopens, which nets out
                    inLiteral = false;
                    i += quote.length();
                } else {
                    i++;
                }
                continue;
            }
            if (sql.startsWith(quote, i)) {
                inLiteral = true;
                i += quote.length();
            } else if (sql.startsWith(token, i)) {
                int end = i + token.length();
                if (dialect.parameterInSequence()) {
                    while (end < sql.length() && Character.isDigit(sql.charAt(end))) {
                        end++;
                    }
                    if (end == i + token.length()) {
                        i = end;
                        continue;
                    }
                }
                spans.add(new int[] {i, end});
                i = end;
            } else {
                i++;
            }
        }
        return spans;
    }

    @Override
    public String toString() {
        return sql + " " + arguments;
    }
}

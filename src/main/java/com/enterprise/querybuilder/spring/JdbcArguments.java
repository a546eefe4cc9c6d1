package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.sql.builder.BuildResult;

import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.PreparedStatementSetter;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Bridges a {@link BuildResult} to Spring JDBC. Nothing here touches a
 * connection; the setter is applied by whoever executes the statement:
 * <pre>{@code
 * BuildResult r = builder.build();
 * jdbcTemplate.update(r.sql(), JdbcArguments.statementSetter(r));
 * }</pre>
 */
public final class JdbcArguments {

    private JdbcArguments() {}

    public static PreparedStatementSetter statementSetter(BuildResult result) {
        return new ArgumentPreparedStatementSetter(toJdbcValues(result));
    }

    /**
     * Arguments converted for drivers without JDBC 4.2 java.time support:
     * {@code LocalDate} to {@code java.sql.Date}, {@code LocalDateTime} and
     * {@code OffsetDateTime} to {@code Timestamp}. Other values pass through.
     */
    public static Object[] toJdbcValues(BuildResult result) {
        List<Object> args = result.arguments();
        Object[] out = new Object[args.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = toJdbcValue(args.get(i));
        }
        return out;
    }

    static Object toJdbcValue(Object value) {
        if (value instanceof LocalDate ld) {
            return java.sql.Date.valueOf(ld);
        }
        if (value instanceof LocalDateTime ldt) {
            return Timestamp.valueOf(ldt);
        }
        if (value instanceof OffsetDateTime odt) {
            return Timestamp.from(odt.toInstant());
        }
        return value;
    }
}

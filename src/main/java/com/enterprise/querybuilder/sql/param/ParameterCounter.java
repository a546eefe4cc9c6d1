package com.enterprise.querybuilder.sql.param;

import com.enterprise.querybuilder.sql.core.SqlDialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hands out positional placeholders and records the bound values in the
 * same order, so the argument list always lines up with the placeholders in
 * the text. The counter starts at the builder's parameter offset and only
 * moves when the dialect numbers its placeholders.
 *
 * <p>Not thread-safe; one counter per build.
 */
public class ParameterCounter {

    private final SqlDialect dialect;
    private final List<Object> arguments = new ArrayList<>();
    private int position;

    public ParameterCounter(SqlDialect dialect, int offset) {
        this.dialect = dialect;
        this.position = offset;
    }

    /**
     * Binds a value and returns its placeholder (e.g. {@code ?}, {@code @p3}).
     */
    public String bind(Scalar value) {
        if (dialect.parameterInSequence()) {
            position++;
        }
        arguments.add(value.value());
        return dialect.placeholder(position);
    }

    /**
     * Appends values bound by someone else, whose placeholders started after
     * {@link #position()}.
     */
    public void addExternal(List<?> values) {
        arguments.addAll(values);
        if (dialect.parameterInSequence()) {
            position += values.size();
        }
    }

    public int position() {
        return position;
    }

    public List<Object> getArguments() {
        return Collections.unmodifiableList(new ArrayList<>(arguments));
    }
}

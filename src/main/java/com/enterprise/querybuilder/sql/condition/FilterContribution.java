package com.enterprise.querybuilder.sql.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record FilterContribution(List<String> expressions, List<Object> arguments) {

    public FilterContribution {
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
        // arguments may legitimately hold nulls, so no List.copyOf here
        arguments = arguments == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static FilterContribution none() {
        return new FilterContribution(List.of(), List.of());
    }

    public boolean isEmpty() {
        return expressions.isEmpty();
    }
}

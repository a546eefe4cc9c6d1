package com.enterprise.querybuilder.sql.builder;

import com.enterprise.querybuilder.sql.builder.QueryBuildException.Reason;
import com.enterprise.querybuilder.sql.condition.Filter;
import com.enterprise.querybuilder.sql.condition.FilterContribution;
import com.enterprise.querybuilder.sql.condition.FilterContributor;
import com.enterprise.querybuilder.sql.core.CommandType;
import com.enterprise.querybuilder.sql.core.LimitPosition;
import com.enterprise.querybuilder.sql.core.SqlDialect;
import com.enterprise.querybuilder.sql.interpolation.TableInterpolator;
import com.enterprise.querybuilder.sql.param.ParameterCounter;
import com.enterprise.querybuilder.sql.param.Scalar;
import com.enterprise.querybuilder.sql.param.SqlLiteralFormatter;
import com.enterprise.querybuilder.sql.param.ValueNormalizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a {@link QueryBuilder} into SQL text. Works on a resolved copy of the
 * builder's values; the builder itself is only read.
 *
 * <p>Emission order: header, columns/values, WHERE (built-in filters, then
 * the contributor), GROUP BY, ORDER BY, rear limit, insert return, {@code ;}.
 * Placeholders are bound through one {@link ParameterCounter}, so arguments
 * come out in exactly the order their placeholders appear.
 */
final class StatementAssembler {

    private static final Logger log = LoggerFactory.getLogger(StatementAssembler.class);

    private final QueryBuilder builder;
    private final SqlDialect dialect;
    private final CommandType command;
    private final boolean literal;

    StatementAssembler(QueryBuilder builder, boolean literal) {
        this.builder = builder;
        this.dialect = builder.dialect();
        this.command = builder.commandType();
        this.literal = literal;
    }

    Assembled assemble() {
        validate();
        List<ResolvedValue> values = command == CommandType.DELETE ? List.of() : resolveValues();
        validateWrittenValues(values);

        ParameterCounter counter = new ParameterCounter(dialect, builder.parameterOffset());
        StringBuilder sql = new StringBuilder();

        switch (command) {
            case SELECT -> appendSelect(sql, values);
            case INSERT -> appendInsert(sql, values, counter);
            case UPDATE -> appendUpdate(sql, values, counter);
            case DELETE -> sql.append("DELETE FROM ").append(builder.source());
        }

        if (command.acceptsFilters()) {
            appendWhere(sql, counter);
        }

        if (!builder.groups().isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", builder.groups()));
        }

        if (!builder.sorts().isEmpty()) {
            sql.append(" ORDER BY ").append(builder.sorts().stream()
                    .map(s -> s.column() + " " + s.direction().name())
                    .collect(Collectors.joining(", ")));
        }

        if (hasLimit() && dialect.limitPosition() == LimitPosition.REAR) {
            sql.append(" ").append(dialect.limit(builder.resultLimit()));
        }

        appendTerminator(sql);

        String text = interpolate(sql.toString());
        List<Object> arguments = literal ? List.of() : counter.getArguments();
        if (log.isDebugEnabled()) {
            log.debug("Built {} on {} ({} argument(s)): {}", command, builder.source(), arguments.size(), text);
        }
        return new Assembled(text, arguments, literal ? builder.parameterOffset() : counter.position());
    }

    // ==================== Validation ====================

    private void validate() {
        if (builder.source() == null || builder.source().isEmpty()) {
            throw new QueryBuildException(Reason.MISSING_SOURCE);
        }
        if (command != CommandType.DELETE && builder.columns().isEmpty()) {
            throw new QueryBuildException(Reason.MISSING_COLUMNS);
        }
        if (command != CommandType.SELECT && !builder.sorts().isEmpty()) {
            throw new QueryBuildException(Reason.ORDERING_NOT_SUPPORTED, command.name());
        }
        if (command != CommandType.SELECT && !builder.groups().isEmpty()) {
            throw new QueryBuildException(Reason.GROUPING_NOT_SUPPORTED, command.name());
        }
    }

    private void validateWrittenValues(List<ResolvedValue> values) {
        if (!command.writesValues()) {
            return;
        }
        if (values.stream().noneMatch(ResolvedValue::rendered)) {
            throw new QueryBuildException(Reason.MISSING_COLUMNS,
                    "every value of " + builder.source() + " was skipped as absent");
        }
        for (ResolvedValue v : values) {
            if (v.rendered() && !v.nullish && !v.parameter
                    && !SqlLiteralFormatter.isRawRenderable(v.value)) {
                throw new QueryBuildException(Reason.RAW_FRAGMENT_NOT_TEXTUAL,
                        v.column + " is " + v.value.getClass().getSimpleName());
            }
        }
    }

    // ==================== Resolution ====================

    private List<ResolvedValue> resolveValues() {
        List<ResolvedValue> resolved = new ArrayList<>(builder.values().size());
        for (QueryBuilder.ValueEntry entry : builder.values()) {
            resolved.add(resolve(entry));
        }
        return resolved;
    }

    /**
     * Order matters: default substitution first, so a default can still be
     * matched to NULL.
     */
    private ResolvedValue resolve(QueryBuilder.ValueEntry entry) {
        Scalar value = ValueNormalizer.normalize(entry.value);
        Scalar defaultValue = ValueNormalizer.normalize(entry.defaultValue);
        Scalar matchToNull = ValueNormalizer.normalize(entry.matchToNull);

        boolean nullish = value == null;
        if (nullish && defaultValue != null) {
            value = defaultValue;
            nullish = false;
        }

        boolean forceNull = false;
        boolean parameter = entry.parameter;
        if (!nullish && matchToNull != null && matchToNull.equals(value)) {
            nullish = true;
            forceNull = true;
            parameter = true;
        }

        boolean skip = builder.isSkipNilWrite() && nullish && !forceNull;
        return new ResolvedValue(entry.column, nullish ? null : value, parameter, nullish, skip);
    }

    // ==================== Clauses ====================

    private void appendSelect(StringBuilder sql, List<ResolvedValue> values) {
        sql.append("SELECT ");
        if (builder.isDistinct()) {
            sql.append("DISTINCT ");
        }
        if (hasLimit() && dialect.limitPosition() == LimitPosition.FRONT) {
            sql.append(dialect.top(builder.resultLimit())).append(" ");
        }
        // SELECT lists every column, absent values included
        sql.append(values.stream().map(v -> v.column).collect(Collectors.joining(", ")));
        sql.append(" FROM ").append(builder.source());
    }

    private void appendInsert(StringBuilder sql, List<ResolvedValue> values, ParameterCounter counter) {
        List<String> names = new ArrayList<>();
        List<String> rendered = new ArrayList<>();
        for (ResolvedValue v : values) {
            if (!v.rendered()) {
                continue;
            }
            names.add(v.column);
            rendered.add(render(v, counter));
        }
        sql.append("INSERT INTO ").append(builder.source())
           .append(" (").append(String.join(", ", names)).append(")")
           .append(" VALUES (").append(String.join(", ", rendered)).append(")");
    }

    private void appendUpdate(StringBuilder sql, List<ResolvedValue> values, ParameterCounter counter) {
        List<String> assignments = new ArrayList<>();
        for (ResolvedValue v : values) {
            if (v.rendered()) {
                assignments.add(v.column + " = " + render(v, counter));
            }
        }
        sql.append("UPDATE ").append(builder.source()).append(" SET ")
           .append(String.join(", ", assignments));
    }

    private String render(ResolvedValue v, ParameterCounter counter) {
        if (v.nullish) {
            return "NULL";
        }
        if (!v.parameter) {
            return SqlLiteralFormatter.formatRaw(v.value);
        }
        return literal ? SqlLiteralFormatter.format(v.value, dialect) : counter.bind(v.value);
    }

    private void appendWhere(StringBuilder sql, ParameterCounter counter) {
        List<String> predicates = new ArrayList<>();
        for (Filter f : builder.filters()) {
            Scalar value = ValueNormalizer.normalize(f.value());
            if (value != null) {
                String rhs = literal ? SqlLiteralFormatter.format(value, dialect) : counter.bind(value);
                predicates.add(f.expression() + " = " + rhs);
            } else if (!f.expressionOnly()) {
                predicates.add(f.expression() + " IS NULL");
            } else {
                predicates.add(f.expression());
            }
        }

        FilterContributor contributor = builder.filterContributor();
        if (contributor != null) {
            FilterContribution c = contributor.contribute(counter.position(),
                    dialect.parameterPlaceholder(), dialect.parameterInSequence());
            if (c != null && !c.isEmpty()) {
                if (literal && !c.arguments().isEmpty()) {
                    throw new QueryBuildException(Reason.CONTRIBUTOR_ARGUMENTS_IN_LITERAL_MODE);
                }
                predicates.addAll(c.expressions());
                counter.addExternal(c.arguments());
            }
        }

        if (!predicates.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
    }

    private void appendTerminator(StringBuilder sql) {
        String returnSql = builder.insertReturnSql();
        if (command != CommandType.INSERT || returnSql == null) {
            sql.append(";");
            return;
        }
        if (builder.insertReturnInline()) {
            sql.append(" ").append(returnSql).append(";");
        } else {
            sql.append("; ").append(returnSql);
            if (!returnSql.endsWith(";")) {
                sql.append(";");
            }
        }
    }

    private String interpolate(String sql) {
        if (!builder.isInterpolateTables()) {
            if (builder.isReferenceMode()) {
                log.warn("Reference mode is ignored while table interpolation is off ({})", builder.source());
            }
            return sql;
        }
        String qualifier = TableInterpolator.resolveQualifier(
                builder.schema(), builder.isReferenceMode(), builder.referenceModePrefix());
        return TableInterpolator.interpolate(sql, qualifier);
    }

    private boolean hasLimit() {
        return !builder.resultLimit().isEmpty();
    }

    // ==================== Inner types ====================

    record Assembled(String sql, List<Object> arguments, int parameterOffset) {}

    /**
     * A column value after default and match-to-null handling.
     * {@code value} is null exactly when {@code nullish} is true.
     */
    private record ResolvedValue(String column, Scalar value, boolean parameter,
                                 boolean nullish, boolean skip) {

        /** Whether INSERT/UPDATE emit this column at all. */
        boolean rendered() {
            return !skip;
        }
    }
}

package com.enterprise.querybuilder.sql.builder;

import com.enterprise.querybuilder.sql.condition.Filter;
import com.enterprise.querybuilder.sql.condition.FilterContributor;
import com.enterprise.querybuilder.sql.core.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fluent builder for SELECT, INSERT, UPDATE and DELETE statements over a
 * single table or view.
 *
 * <p>Two outputs:
 * <ul>
 *   <li>{@link #build()}: SQL with placeholders plus the ordered arguments</li>
 *   <li>{@link #buildLiteral()}: SQL with every value inlined</li>
 * </ul>
 *
 * <p>Columns are identified by name ignoring case; adding a value for a
 * column that already has one replaces it. Absent values ({@code null},
 * empty {@link java.util.Optional}) are skipped from INSERT/UPDATE while
 * {@link #skipNilWrite(boolean)} is on (the default), or written as NULL.
 *
 * <p>Table names written as {@code {Name}} are qualified with the schema (or
 * reference prefix) after assembly, see {@link #interpolate(boolean)}.
 *
 * <p>Example:
 * <pre>{@code
 * BuildResult r = QueryBuilder.update("{users}")
 *     .dialect(Dialects.SQL_SERVER)
 *     .schema("sales")
 *     .addValue("UserName", "john.doe")
 *     .addValue("ModifiedOn", "GETDATE()", ValueOptions.raw())
 *     .addFilter("Id", 123)
 *     .build();
 * // UPDATE sales.users SET UserName = @p1, ModifiedOn = GETDATE() WHERE Id = @p2;
 * }</pre>
 *
 * <p>Not thread-safe. {@link #build()} leaves the stored values untouched
 * but advances {@link #parameterOffset()}, so a second build continues the
 * placeholder numbering.
 */
public class QueryBuilder {

    static final int DEFAULT_COLUMN_LENGTH = 255;
    static final int VALUE_COLUMN_LENGTH = 8000;
    static final String DEFAULT_REFERENCE_PREFIX = "ref";

    // Statement
    private String source;
    private CommandType commandType = CommandType.SELECT;
    private boolean distinct;
    private final List<Column> columns = new ArrayList<>();
    private final List<ValueEntry> values = new ArrayList<>();
    private final List<Filter> filters = new ArrayList<>();
    private final List<Sort> sorts = new ArrayList<>();
    private final List<String> groups = new ArrayList<>();
    private String resultLimit = "";
    private int parameterOffset;
    private FilterContributor filterContributor;
    private String insertReturnSql;
    private boolean insertReturnInline;

    // Engine settings, carried over by spawn()
    private SqlDialect dialect = Dialects.DEFAULT;
    private boolean skipNilWrite = true;
    private boolean interpolateTables = true;
    private String schema;
    private boolean referenceMode;
    private String referenceModePrefix = DEFAULT_REFERENCE_PREFIX;

    private QueryBuilder() {
    }

    // ==================== Factory ====================

    public static QueryBuilder create() {
        return new QueryBuilder();
    }

    /**
     * @param dataObject table, view or joined source, e.g. {@code {users} u JOIN {roles} r ON ...}
     */
    public static QueryBuilder select(String dataObject) {
        return create().source(dataObject).command(CommandType.SELECT);
    }

    public static QueryBuilder insert(String table) {
        return create().source(table).command(CommandType.INSERT);
    }

    public static QueryBuilder update(String table) {
        return create().source(table).command(CommandType.UPDATE);
    }

    public static QueryBuilder delete(String table) {
        return create().source(table).command(CommandType.DELETE);
    }

    /**
     * New builder with the engine settings of {@code template} (dialect,
     * skip-nil policy, interpolation, schema, reference mode). Everything
     * else starts empty.
     */
    public static QueryBuilder spawn(QueryBuilder template) {
        Objects.requireNonNull(template, "template");
        QueryBuilder b = new QueryBuilder();
        b.dialect = template.dialect;
        b.skipNilWrite = template.skipNilWrite;
        b.interpolateTables = template.interpolateTables;
        b.schema = template.schema;
        b.referenceMode = template.referenceMode;
        b.referenceModePrefix = template.referenceModePrefix;
        return b;
    }

    public static QueryBuilder spawnSelect(QueryBuilder template, String dataObject) {
        return spawn(template).source(dataObject).command(CommandType.SELECT);
    }

    public static QueryBuilder spawnInsert(QueryBuilder template, String table) {
        return spawn(template).source(table).command(CommandType.INSERT);
    }

    public static QueryBuilder spawnUpdate(QueryBuilder template, String table) {
        return spawn(template).source(table).command(CommandType.UPDATE);
    }

    public static QueryBuilder spawnDelete(QueryBuilder template, String table) {
        return spawn(template).source(table).command(CommandType.DELETE);
    }

    // ==================== Settings ====================

    public QueryBuilder source(String name) {
        this.source = name;
        return this;
    }

    public QueryBuilder command(CommandType type) {
        this.commandType = Objects.requireNonNull(type, "commandType");
        return this;
    }

    public QueryBuilder distinct(boolean yes) {
        this.distinct = yes;
        return this;
    }

    public QueryBuilder dialect(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        return this;
    }

    /** When on, absent INSERT/UPDATE values are left out instead of written as NULL. */
    public QueryBuilder skipNilWrite(boolean skip) {
        this.skipNilWrite = skip;
        return this;
    }

    /** Turns {@code {Table}} qualification on or off. On by default. */
    public QueryBuilder interpolate(boolean value) {
        this.interpolateTables = value;
        return this;
    }

    public QueryBuilder schema(String schema) {
        this.schema = schema;
        return this;
    }

    /**
     * Qualifies interpolated tables with the reference prefix ({@code ref_})
     * instead of the schema, for objects populated by an event source.
     * A schema, when set, still wins. Ignored while interpolation is off.
     */
    public QueryBuilder referenceMode(boolean value) {
        this.referenceMode = value;
        return this;
    }

    /** Changes the reference-mode prefix. An empty prefix is ignored. */
    public QueryBuilder referenceModePrefix(String prefix) {
        if (prefix != null && !prefix.isEmpty()) {
            this.referenceModePrefix = prefix;
        }
        return this;
    }

    public QueryBuilder resultLimit(String limit) {
        this.resultLimit = limit == null ? "" : limit;
        return this;
    }

    public QueryBuilder resultLimit(int limit) {
        return resultLimit(Integer.toString(limit));
    }

    /** Number of the last placeholder already used; numbering continues after it. */
    public QueryBuilder parameterOffset(int offset) {
        this.parameterOffset = offset;
        return this;
    }

    public QueryBuilder filterContributor(FilterContributor contributor) {
        this.filterContributor = contributor;
        return this;
    }

    /**
     * Appends a statement that returns the generated key of an INSERT.
     * Inline SQL goes before the terminating semicolon
     * ({@code ... VALUES (?) RETURNING id;}); otherwise it follows as its
     * own statement ({@code ... VALUES (?); SELECT SCOPE_IDENTITY();}).
     */
    public QueryBuilder insertReturn(String sql, boolean inline) {
        this.insertReturnSql = sql == null || sql.isEmpty() ? null : sql;
        this.insertReturnInline = inline;
        return this;
    }

    // ==================== Columns and values ====================

    /** Adds a column to select or write. Ignored for DELETE. */
    public QueryBuilder addColumn(String name) {
        return addColumn(name, DEFAULT_COLUMN_LENGTH);
    }

    public QueryBuilder addColumn(String name, int length) {
        if (commandType == CommandType.DELETE) {
            return this;
        }
        int index = addColumnSlot(name, length);
        if (findValue(columns.get(index).name()) != null) {
            // re-adding keeps the value already set
            return this;
        }
        return setColumnValue(index, null, ValueOptions.parameter());
    }

    /** Adds a column with a bound value. Ignored for DELETE. */
    public QueryBuilder addValue(String name, Object value) {
        return addValue(name, value, ValueOptions.parameter());
    }

    public QueryBuilder addValue(String name, Object value, ValueOptions options) {
        Objects.requireNonNull(options, "options");
        if (commandType == CommandType.DELETE) {
            return this;
        }
        return setColumnValue(addColumnSlot(name, VALUE_COLUMN_LENGTH), value, options);
    }

    /**
     * Replaces the value of an already registered column, keeping its
     * options. Unknown names are ignored.
     */
    public QueryBuilder setColumnValue(String name, Object value) {
        if (commandType == CommandType.DELETE) {
            return this;
        }
        ValueEntry entry = findValue(name);
        if (entry != null) {
            entry.value = value;
        }
        return this;
    }

    // ==================== Filters, order, group ====================

    /** {@code column = value}, or {@code column IS NULL} when the value is absent. */
    public QueryBuilder addFilter(String column, Object value) {
        filters.add(Filter.equalTo(column, value));
        return this;
    }

    /** A predicate used verbatim, e.g. {@code CountryCode = 'PHL'}. */
    public QueryBuilder addFilterExp(String expression) {
        filters.add(Filter.expression(expression));
        return this;
    }

    public QueryBuilder addOrder(String column, SortDirection direction) {
        sorts.add(new Sort(Objects.requireNonNull(column, "column"),
                Objects.requireNonNull(direction, "direction")));
        return this;
    }

    public QueryBuilder addGroup(String group) {
        groups.add(Objects.requireNonNull(group, "group"));
        return this;
    }

    // ==================== Build ====================

    /**
     * Builds the statement with placeholders and the matching arguments.
     *
     * @throws QueryBuildException when the builder cannot produce a statement
     */
    public BuildResult build() {
        StatementAssembler.Assembled a = new StatementAssembler(this, false).assemble();
        this.parameterOffset = a.parameterOffset();
        return new BuildResult(a.sql(), a.arguments(), dialect);
    }

    /**
     * Builds the statement with every value inlined as a literal.
     *
     * @throws QueryBuildException when the builder cannot produce a statement
     */
    public String buildLiteral() {
        return new StatementAssembler(this, true).assemble().sql();
    }

    /**
     * Wraps this SELECT as {@code SELECT COUNT(*) FROM (...) AS derived;},
     * keeping its arguments.
     */
    public BuildResult buildCount() {
        return buildCount("derived");
    }

    public BuildResult buildCount(String alias) {
        if (commandType != CommandType.SELECT) {
            throw new QueryBuildException(QueryBuildException.Reason.COUNT_REQUIRES_SELECT,
                    commandType.name());
        }
        BuildResult inner = build();
        String sql = inner.sql().strip();
        while (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).strip();
        }
        return new BuildResult("SELECT COUNT(*) FROM (" + sql + ") AS " + alias + ";",
                inner.arguments(), dialect);
    }

    // ==================== Accessors ====================

    /** Escapes enclosing chars in a string value with the dialect's escape char. */
    public String escape(String value) {
        return dialect.escape(value);
    }

    public String source() { return source; }

    public CommandType commandType() { return commandType; }

    public SqlDialect dialect() { return dialect; }

    public int parameterOffset() { return parameterOffset; }

    public List<Column> columns() { return Collections.unmodifiableList(columns); }

    boolean isDistinct() { return distinct; }
    List<ValueEntry> values() { return values; }
    List<Filter> filters() { return filters; }
    List<Sort> sorts() { return sorts; }
    List<String> groups() { return groups; }
    String resultLimit() { return resultLimit; }
    FilterContributor filterContributor() { return filterContributor; }
    String insertReturnSql() { return insertReturnSql; }
    boolean insertReturnInline() { return insertReturnInline; }
    boolean isSkipNilWrite() { return skipNilWrite; }
    boolean isInterpolateTables() { return interpolateTables; }
    String schema() { return schema; }
    boolean isReferenceMode() { return referenceMode; }
    String referenceModePrefix() { return referenceModePrefix; }

    // ==================== Internal ====================

    private int addColumnSlot(String name, int length) {
        Objects.requireNonNull(name, "column name");
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).hasName(name)) {
                return i;
            }
        }
        columns.add(new Column(name, length));
        return columns.size() - 1;
    }

    private QueryBuilder setColumnValue(int index, Object value, ValueOptions options) {
        String name = columns.get(index).name();
        ValueEntry entry = findValue(name);
        if (entry == null) {
            entry = new ValueEntry(name);
            values.add(entry);
        }
        entry.apply(value, options);
        return this;
    }

    private ValueEntry findValue(String name) {
        for (ValueEntry v : values) {
            if (v.column.equalsIgnoreCase(name)) {
                return v;
            }
        }
        return null;
    }

    record Sort(String column, SortDirection direction) {}

    /** Stored as supplied; normalized only while building. */
    static final class ValueEntry {
        final String column;
        Object value;
        Object defaultValue;
        Object matchToNull;
        boolean parameter;

        ValueEntry(String column) {
            this.column = column;
        }

        void apply(Object value, ValueOptions options) {
            this.value = value;
            this.defaultValue = options.defaultValue();
            this.matchToNull = options.matchToNull();
            this.parameter = options.bound();
        }
    }
}

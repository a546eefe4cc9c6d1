package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.sql.builder.QueryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Hands out fresh builders that share one set of engine settings.
 *
 * <p>Every call spawns a new {@link QueryBuilder} from the template. Builders are
 * not thread-safe, so take a new one per statement:
 * <pre>{@code
 * BuildResult r = factory.select("{users}")
 *     .addColumn("Id")
 *     .addFilter("IsActive", true)
 *     .build();
 * }</pre>
 */
public class QueryBuilderFactory {

    private static final Logger log = LoggerFactory.getLogger(QueryBuilderFactory.class);

    private final QueryBuilder template;

    public QueryBuilderFactory(QueryBuilder template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    public static QueryBuilderFactory from(QueryBuilderProperties properties) {
        if (properties.isDialectUnset()) {
            log.warn("No querybuilder dialect configured; using engine defaults");
        }
        QueryBuilder template = QueryBuilder.create()
                .dialect(properties.toDialect())
                .skipNilWrite(properties.isSkipNilWrite())
                .interpolate(properties.isInterpolateTables())
                .schema(properties.getSchema())
                .referenceMode(properties.isReferenceMode())
                .referenceModePrefix(properties.getReferenceModePrefix());
        return new QueryBuilderFactory(template);
    }

    public QueryBuilder select(String dataObject) {
        return QueryBuilder.spawnSelect(template, dataObject);
    }

    public QueryBuilder insert(String table) {
        return QueryBuilder.spawnInsert(template, table);
    }

    public QueryBuilder update(String table) {
        return QueryBuilder.spawnUpdate(template, table);
    }

    public QueryBuilder delete(String table) {
        return QueryBuilder.spawnDelete(template, table);
    }
}

package com.enterprise.querybuilder.sql;

import com.enterprise.querybuilder.sql.builder.BuildResult;
import com.enterprise.querybuilder.sql.builder.QueryBuildException;
import com.enterprise.querybuilder.sql.builder.QueryBuilder;
import com.enterprise.querybuilder.sql.builder.ValueOptions;
import com.enterprise.querybuilder.sql.core.Dialects;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class DmlBuilderTests {

    // ==================== INSERT ====================

    @Test
    void insertWithNumberedPlaceholders() {
        BuildResult result = QueryBuilder.insert("users")
                .dialect(Dialects.SQL_SERVER)
                .addValue("UserName", "john.doe")
                .addValue("IsActive", true)
                .build();

        assertThat(result.sql()).isEqualTo("INSERT INTO users (UserName, IsActive) VALUES (@p1, @p2);");
        assertThat(result.arguments()).containsExactly("john.doe", true);
    }

    @Test
    void insertWritesNullsWhenNotSkipping() {
        BuildResult result = QueryBuilder.insert("{TableNotSoImportant}")
                .dialect(Dialects.SQL_SERVER)
                .skipNilWrite(false)
                .addValue("UserKey", 5)
                .addValue("UserName", "eaglebush")
                .addValue("Active", false)
                .addValue("Gender", null)
                .addValue("Birthdate", "GETDATE()", ValueOptions.raw())
                .addValue("TraderAddrClassKey", 0, ValueOptions.parameter().withMatchToNull(0))
                .build();

        assertThat(result.sql()).isEqualTo("INSERT INTO TableNotSoImportant "
                + "(UserKey, UserName, Active, Gender, Birthdate, TraderAddrClassKey) "
                + "VALUES (@p1, @p2, @p3, NULL, GETDATE(), NULL);");
        assertThat(result.arguments()).containsExactly(5, "eaglebush", false);
    }

    @Test
    void skippedAbsentValueDisappears() {
        BuildResult result = QueryBuilder.insert("t")
                .addValue("A", 1)
                .addValue("Gender", null)
                .addValue("Key", 0L, ValueOptions.parameter().withMatchToNull(0))
                .build();

        // matched-to-null survives skipping
        assertThat(result.sql()).isEqualTo("INSERT INTO t (A, Key) VALUES (?, NULL);");
        assertThat(result.arguments()).containsExactly(1);
    }

    @Test
    void defaultReplacesAbsentValue() {
        BuildResult result = QueryBuilder.insert("t")
                .addValue("Status", null, ValueOptions.parameter().withDefault("NEW"))
                .addValue("Flag", null, ValueOptions.parameter().withDefault(0).withMatchToNull(0))
                .build();

        assertThat(result.sql()).isEqualTo("INSERT INTO t (Status, Flag) VALUES (?, NULL);");
        assertThat(result.arguments()).containsExactly("NEW");
    }

    @Test
    void insertReturnInline() {
        BuildResult result = QueryBuilder.insert("users")
                .dialect(Dialects.POSTGRES)
                .addValue("Name", "a")
                .insertReturn("RETURNING Id", true)
                .build();

        assertThat(result.sql()).isEqualTo("INSERT INTO users (Name) VALUES ($1) RETURNING Id;");
    }

    @Test
    void insertReturnAsSecondStatement() {
        BuildResult result = QueryBuilder.insert("users")
                .dialect(Dialects.SQL_SERVER)
                .addValue("Name", "a")
                .insertReturn("SELECT SCOPE_IDENTITY()", false)
                .build();

        assertThat(result.sql()).isEqualTo("INSERT INTO users (Name) VALUES (@p1); SELECT SCOPE_IDENTITY();");
    }

    @Test
    void columnNamesAreCaseInsensitive() {
        QueryBuilder qb = QueryBuilder.insert("t")
                .addValue("Name", "a")
                .addValue("NAME", "b");

        assertThat(qb.columns()).hasSize(1);
        BuildResult result = qb.build();
        assertThat(result.sql()).isEqualTo("INSERT INTO t (Name) VALUES (?);");
        assertThat(result.arguments()).containsExactly("b");
    }

    @Test
    void reAddingColumnKeepsItsValue() {
        BuildResult result = QueryBuilder.insert("t").addValue("Name", "a").addColumn("name").build();
        assertThat(result.arguments()).containsExactly("a");
    }

    @Test
    void setColumnValueReplacesKnownColumnsOnly() {
        BuildResult result = QueryBuilder.insert("t")
                .addValue("Name", "a")
                .setColumnValue("name", "z")
                .setColumnValue("Missing", "x")
                .build();

        assertThat(result.sql()).isEqualTo("INSERT INTO t (Name) VALUES (?);");
        assertThat(result.arguments()).containsExactly("z");
    }

    @Test
    void columnLengthHints() {
        QueryBuilder qb = QueryBuilder.insert("t")
                .addColumn("A")
                .addColumn("B", 40)
                .addValue("C", 1);

        assertThat(qb.columns()).extracting(c -> c.length()).containsExactly(255, 40, 8000);
    }

    @Test
    void insertWithEveryValueSkippedIsRejected() {
        QueryBuilder qb = QueryBuilder.insert("users").addValue("MiddleName", null);

        assertThatThrownBy(qb::build)
                .isInstanceOf(QueryBuildException.class)
                .satisfies(e -> assertThat(((QueryBuildException) e).reason())
                        .isEqualTo(QueryBuildException.Reason.MISSING_COLUMNS))
                .hasMessageContaining("skipped");
        assertThatThrownBy(qb::buildLiteral).isInstanceOf(QueryBuildException.class);
    }

    @Test
    void valueOptionsFactoriesAndWithers() {
        assertThat(ValueOptions.parameter().bound()).isTrue();
        assertThat(ValueOptions.raw().bound()).isFalse();

        ValueOptions options = ValueOptions.raw().withDefault("X").withMatchToNull("Y");
        assertThat(options.bound()).isFalse();
        assertThat(options.defaultValue()).isEqualTo("X");
        assertThat(options.matchToNull()).isEqualTo("Y");
        assertThat(options.asParameter(true).bound()).isTrue();
    }

    // ==================== UPDATE ====================

    @Test
    void updateWithEveryValueSkippedIsRejected() {
        QueryBuilder qb = QueryBuilder.update("users")
                .dialect(Dialects.POSTGRES)
                .addValue("MiddleName", null)
                .addFilter("Id", 1);

        assertThatThrownBy(qb::build)
                .isInstanceOf(QueryBuildException.class)
                .satisfies(e -> assertThat(((QueryBuildException) e).reason())
                        .isEqualTo(QueryBuildException.Reason.MISSING_COLUMNS));
        assertThat(qb.parameterOffset()).isZero();
    }

    @Test
    void updateWithOnlyForcedNullStillBuilds() {
        BuildResult result = QueryBuilder.update("users")
                .addValue("Key", 0, ValueOptions.parameter().withMatchToNull(0))
                .build();

        assertThat(result.sql()).isEqualTo("UPDATE users SET Key = NULL;");
    }

    @Test
    void updateSkipsAbsentValues() {
        BuildResult result = QueryBuilder.update("users")
                .dialect(Dialects.POSTGRES)
                .addValue("UserName", "john.doe")
                .addValue("MiddleName", null)
                .addFilter("Id", 123)
                .build();

        assertThat(result.sql()).isEqualTo("UPDATE users SET UserName = $1 WHERE Id = $2;");
        assertThat(result.arguments()).containsExactly("john.doe", 123);
    }

    @Test
    void updateWithSchemaRawFragmentsAndMixedFilters() {
        BuildResult result = QueryBuilder.update("{TableNotSoImportant}")
                .schema("hack")
                .dialect(Dialects.POSTGRES)
                .skipNilWrite(false)
                .addValue("UserKey", 5)
                .addValue("UserName", "eaglebush")
                .addValue("Active", false)
                .addValue("Birthdate", "GETDATE()", ValueOptions.raw())
                .addValue("DateCreated", "1/1/1900", ValueOptions.raw().withMatchToNull("1/1/1900"))
                .addValue("Gender", null)
                .addFilterExp("CountryCode='PHL'")
                .addFilter("Town", "Manila")
                .addFilter("District", null)
                .build();

        assertThat(result.sql()).isEqualTo("UPDATE hack.TableNotSoImportant SET UserKey = $1, UserName = $2, "
                + "Active = $3, Birthdate = GETDATE(), DateCreated = NULL, Gender = NULL "
                + "WHERE CountryCode='PHL' AND Town = $4 AND District IS NULL;");
        assertThat(result.arguments()).containsExactly(5, "eaglebush", false, "Manila");
        result.verify();
    }

    @Test
    void rawNumberIsInlined() {
        BuildResult result = QueryBuilder.update("stock").addValue("Qty", 5, ValueOptions.raw()).build();
        assertThat(result.sql()).isEqualTo("UPDATE stock SET Qty = 5;");
        assertThat(result.arguments()).isEmpty();
    }

    @Test
    void rawTimestampIsRejected() {
        QueryBuilder qb = QueryBuilder.update("t").addValue("Stamp", LocalDateTime.now(), ValueOptions.raw());

        assertThatThrownBy(qb::build)
                .isInstanceOf(QueryBuildException.class)
                .hasMessageContaining("Stamp");
    }

    @Test
    void insertReturnIgnoredForUpdate() {
        BuildResult result = QueryBuilder.update("t")
                .addValue("A", 1)
                .insertReturn("RETURNING Id", true)
                .build();

        assertThat(result.sql()).isEqualTo("UPDATE t SET A = ?;");
    }

    // ==================== DELETE ====================

    @Test
    void deleteIgnoresColumnsAndValues() {
        QueryBuilder qb = QueryBuilder.delete("users")
                .addColumn("Name")
                .addValue("Name", "x")
                .addFilter("Id", 123);

        assertThat(qb.columns()).isEmpty();
        BuildResult result = qb.build();
        assertThat(result.sql()).isEqualTo("DELETE FROM users WHERE Id = ?;");
        assertThat(result.arguments()).containsExactly(123);
    }

    @Test
    void deleteWithoutFilters() {
        assertThat(QueryBuilder.delete("{logs}").schema("app").build().sql())
                .isEqualTo("DELETE FROM app.logs;");
    }

    // ==================== Spawn ====================

    @Test
    void spawnCopiesSettingsNotState() {
        QueryBuilder template = QueryBuilder.create()
                .dialect(Dialects.POSTGRES)
                .schema("s")
                .skipNilWrite(false)
                .addFilter("Leaked", 1)
                .resultLimit(5);

        BuildResult result = QueryBuilder.spawnInsert(template, "{t}").addValue("A", null).build();

        assertThat(result.sql()).isEqualTo("INSERT INTO s.t (A) VALUES (NULL);");
        assertThat(QueryBuilder.spawnSelect(template, "x").addColumn("Id").build().sql())
                .isEqualTo("SELECT Id FROM x;");
    }

    @Test
    void escapeUsesDialect() {
        assertThat(QueryBuilder.create().dialect(Dialects.SQL_SERVER).escape("O'Neil")).isEqualTo("O''Neil");
    }
}

package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.sql.core.Dialects;
import com.enterprise.querybuilder.sql.core.LimitPosition;
import com.enterprise.querybuilder.sql.core.SqlDialect;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings for builders handed out by {@link QueryBuilderFactory}.
 *
 * <pre>
 * querybuilder.dialect=sqlserver
 * querybuilder.parameter-placeholder=@p
 * querybuilder.schema=sales
 * querybuilder.skip-nil-write=true
 * </pre>
 *
 * Individual dialect fields override the chosen preset.
 */
@ConfigurationProperties(prefix = "querybuilder")
public class QueryBuilderProperties {

    /** Preset name: default, sqlserver, postgres, mysql. */
    private String dialect;
    private String stringEnclosingChar;
    private String stringEscapeChar;
    private String reservedWordEscapeChars;
    private String parameterPlaceholder;
    private Boolean parameterInSequence;
    private LimitPosition limitPosition;

    private boolean skipNilWrite = true;
    private boolean interpolateTables = true;
    private String schema;
    private boolean referenceMode;
    private String referenceModePrefix = "ref";

    /** True when neither a preset nor any dialect field was configured. */
    public boolean isDialectUnset() {
        return dialect == null && stringEnclosingChar == null && stringEscapeChar == null
                && reservedWordEscapeChars == null && parameterPlaceholder == null
                && parameterInSequence == null && limitPosition == null;
    }

    /**
     * Resolves the preset and applies the per-field overrides.
     *
     * @throws IllegalArgumentException for an unknown preset
     */
    public SqlDialect toDialect() {
        SqlDialect base = dialect == null || dialect.isBlank() ? Dialects.DEFAULT : Dialects.named(dialect);
        return new SqlDialect(
                stringEnclosingChar != null ? stringEnclosingChar : base.stringEnclosingChar(),
                stringEscapeChar != null ? stringEscapeChar : base.stringEscapeChar(),
                reservedWordEscapeChars != null ? reservedWordEscapeChars : base.reservedWordEscapeChars(),
                parameterPlaceholder != null ? parameterPlaceholder : base.parameterPlaceholder(),
                parameterInSequence != null ? parameterInSequence : base.parameterInSequence(),
                limitPosition != null ? limitPosition : base.limitPosition());
    }

    public String getDialect() { return dialect; }
    public void setDialect(String dialect) { this.dialect = dialect; }
    public String getStringEnclosingChar() { return stringEnclosingChar; }
    public void setStringEnclosingChar(String stringEnclosingChar) { this.stringEnclosingChar = stringEnclosingChar; }
    public String getStringEscapeChar() { return stringEscapeChar; }
    public void setStringEscapeChar(String stringEscapeChar) { this.stringEscapeChar = stringEscapeChar; }
    public String getReservedWordEscapeChars() { return reservedWordEscapeChars; }
    public void setReservedWordEscapeChars(String chars) { this.reservedWordEscapeChars = chars; }
    public String getParameterPlaceholder() { return parameterPlaceholder; }
    public void setParameterPlaceholder(String parameterPlaceholder) { this.parameterPlaceholder = parameterPlaceholder; }
    public Boolean getParameterInSequence() { return parameterInSequence; }
    public void setParameterInSequence(Boolean parameterInSequence) { this.parameterInSequence = parameterInSequence; }
    public LimitPosition getLimitPosition() { return limitPosition; }
    public void setLimitPosition(LimitPosition limitPosition) { this.limitPosition = limitPosition; }
    public boolean isSkipNilWrite() { return skipNilWrite; }
    public void setSkipNilWrite(boolean skipNilWrite) { this.skipNilWrite = skipNilWrite; }
    public boolean isInterpolateTables() { return interpolateTables; }
    public void setInterpolateTables(boolean interpolateTables) { this.interpolateTables = interpolateTables; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public boolean isReferenceMode() { return referenceMode; }
    public void setReferenceMode(boolean referenceMode) { this.referenceMode = referenceMode; }
    public String getReferenceModePrefix() { return referenceModePrefix; }
    public void setReferenceModePrefix(String referenceModePrefix) { this.referenceModePrefix = referenceModePrefix; }
}

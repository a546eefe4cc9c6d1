package com.enterprise.querybuilder.sql.interpolation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites brace-delimited table tokens: {@code {Users}} becomes
 * {@code sales.Users} with qualifier {@code sales}, or plain {@code Users}
 * without one. Text outside braces is left untouched.
 */
public final class TableInterpolator {

    private static final Pattern TABLE_TOKEN = Pattern.compile("\\{([a-zA-Z0-9\\[\\]\"_\\-]*)\\}");

    private TableInterpolator() {}

    public static String interpolate(String sql, String qualifier) {
        String prefix = qualifier == null || qualifier.isEmpty() ? "" : qualifier + ".";
        Matcher m = TABLE_TOKEN.matcher(sql);
        StringBuilder sb = new StringBuilder(sql.length() + 16);
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(prefix + m.group(1)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Picks the qualifier: an explicit schema wins, then the reference-mode
     * prefix (suffixed with {@code _}), then nothing.
     */
    public static String resolveQualifier(String schema, boolean referenceMode, String referencePrefix) {
        if (schema != null && !schema.isEmpty()) {
            return schema;
        }
        if (referenceMode && referencePrefix != null && !referencePrefix.isEmpty()) {
            return referencePrefix.endsWith("_") ? referencePrefix : referencePrefix + "_";
        }
        return "";
    }
}

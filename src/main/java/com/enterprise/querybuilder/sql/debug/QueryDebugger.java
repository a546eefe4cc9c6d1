package com.enterprise.querybuilder.sql.debug;

import com.enterprise.querybuilder.sql.builder.BuildResult;
import com.enterprise.querybuilder.sql.core.SqlDialect;

import java.util.List;
import java.util.Locale;

/**
 * Debug utility: dumps a {@link BuildResult} as the parameterized text, the
 * same text with arguments inlined, and the numbered argument list with Java
 * types. A placeholder/argument mismatch is flagged instead of thrown.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(BuildResult result) {
        SqlDialect dialect = result.dialect();
        List<Object> args = result.arguments();
        int placeholders = result.placeholderCount();

        StringBuilder out = new StringBuilder("--- query ---\n");
        out.append("Placeholder: ").append(dialect.parameterPlaceholder())
           .append(dialect.parameterInSequence() ? "n" : "")
           .append(", limit ").append(dialect.limitPosition().name().toLowerCase(Locale.ROOT)).append("\n");

        out.append("SQL (parameterized):\n    ").append(result.sql()).append("\n");
        out.append("SQL (values inlined):\n    ").append(result.toDebugString()).append("\n");

        out.append("Arguments (").append(args.size()).append("):");
        if (placeholders != args.size()) {
            out.append(" MISMATCH, ").append(placeholders).append(" placeholder(s)");
        }
        out.append("\n");
        for (int i = 0; i < args.size(); i++) {
            Object arg = args.get(i);
            out.append("    ").append(i + 1).append(" = ").append(arg)
               .append(" (").append(arg == null ? "null" : arg.getClass().getSimpleName()).append(")\n");
        }
        return out.append("-------------").toString();
    }
}

package org.iceforge.pivot.sql;

import java.util.regex.Pattern;

/**
 * Identifier rendering shared by the compiler and the schema summary.
 */
public final class SqlIdentifiers {

    private static final Pattern PLAIN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {
    }

    /**
     * Returns the identifier as is when it is a plain ASCII word, otherwise double-quoted with
     * embedded quotes doubled.
     */
    public static String quoteIfNeeded(String name) {
        if (isPlain(name)) {
            return name;
        }
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    static boolean isPlain(String name) {
        return PLAIN.matcher(name).matches();
    }

    /**
     * Renders a possibly schema-qualified table name. {@code defaultSchema} is applied only to
     * names that carry no schema of their own.
     */
    public static String table(String table, String defaultSchema) {
        int dot = table.indexOf('.');
        if (dot > 0) {
            return quoteIfNeeded(table.substring(0, dot)) + "." + quoteIfNeeded(table.substring(dot + 1));
        }
        if (defaultSchema != null && !defaultSchema.isBlank()) {
            return quoteIfNeeded(defaultSchema.trim()) + "." + quoteIfNeeded(table);
        }
        return quoteIfNeeded(table);
    }

    /**
     * Last segment of a possibly schema-qualified table name.
     */
    public static String baseName(String table) {
        int dot = table.lastIndexOf('.');
        return dot >= 0 ? table.substring(dot + 1) : table;
    }
}

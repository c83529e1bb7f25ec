package org.iceforge.pivot.sql;

import java.util.Locale;
import java.util.Set;

/**
 * Functions a generated statement may call: aggregates, window functions and side-effect free
 * scalars. Anything else (catalog, file, sequence or session functions) is rejected, since a
 * function can read relations the whitelist never sees.
 */
final class SqlFunctions {

    private static final Set<String> ALLOWED = Set.of(
            // aggregates
            "SUM", "COUNT", "AVG", "MIN", "MAX",
            "STDDEV", "STDDEV_POP", "STDDEV_SAMP", "VARIANCE", "VAR_POP", "VAR_SAMP",
            "BOOL_AND", "BOOL_OR", "EVERY",
            // window
            "ROW_NUMBER", "RANK", "DENSE_RANK", "PERCENT_RANK", "CUME_DIST", "NTILE",
            "LAG", "LEAD", "FIRST_VALUE", "LAST_VALUE", "NTH_VALUE",
            // numeric
            "ABS", "ROUND", "TRUNC", "TRUNCATE", "CEIL", "CEILING", "FLOOR", "MOD", "POWER", "SQRT",
            "EXP", "LN", "LOG", "LOG10", "SIGN", "GREATEST", "LEAST",
            // conditional and conversion
            "COALESCE", "NULLIF", "CAST", "EXTRACT", "DATE_PART", "DATE_TRUNC", "TO_CHAR",
            // string
            "UPPER", "LOWER", "INITCAP", "TRIM", "LTRIM", "RTRIM", "BTRIM", "SUBSTRING", "SUBSTR",
            "POSITION", "CHAR_LENGTH", "CHARACTER_LENGTH", "LENGTH", "CONCAT", "REPLACE",
            "LEFT", "RIGHT", "LPAD", "RPAD",
            // date and time
            "CURRENT_DATE", "CURRENT_TIMESTAMP", "LOCALTIMESTAMP", "NOW");

    private SqlFunctions() {
    }

    static boolean isAllowed(String name) {
        return name != null && ALLOWED.contains(name.toUpperCase(Locale.ROOT));
    }
}

package org.iceforge.pivot.sql;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical view of a statement with the contents of string literals and quoted identifiers
 * blanked out, so keyword and punctuation checks cannot be fooled by (or trip over) quoted
 * text. Offsets in {@link #masked()} match offsets in the original text.
 */
final class SqlText {

    private static final Pattern TOP_LEVEL_LIMIT =
            Pattern.compile("\\bLIMIT\\s+(\\d+|ALL)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOP_LEVEL_FETCH =
            Pattern.compile("\\bFETCH\\s+(?:FIRST|NEXT)\\s+(\\d+)\\b", Pattern.CASE_INSENSITIVE);

    private final String original;
    private final String masked;
    private final int[] depth;

    private SqlText(String original, String masked, int[] depth) {
        this.original = original;
        this.masked = masked;
        this.depth = depth;
    }

    /**
     * @throws IllegalArgumentException when a literal or quoted identifier is not closed
     */
    static SqlText of(String sql) {
        char[] out = sql.toCharArray();
        int[] depth = new int[sql.length() + 1];
        int level = 0;
        int i = 0;
        while (i < out.length) {
            char c = out[i];
            if (c == '\'' || c == '"') {
                int close = closing(sql, i, c);
                if (close < 0) {
                    throw new IllegalArgumentException("unterminated " + (c == '\'' ? "string literal" : "quoted identifier"));
                }
                for (int j = i + 1; j < close; j++) {
                    out[j] = ' ';
                    depth[j] = level;
                }
                depth[i] = level;
                depth[close] = level;
                i = close + 1;
                continue;
            }
            if (c == '(') {
                depth[i] = level;
                level++;
            } else if (c == ')') {
                level = Math.max(0, level - 1);
                depth[i] = level;
            } else {
                depth[i] = level;
            }
            i++;
        }
        depth[out.length] = level;
        return new SqlText(sql, new String(out), depth);
    }

    private static int closing(String sql, int open, char quote) {
        int i = open + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    String masked() {
        return masked;
    }

    /**
     * The last LIMIT (or FETCH FIRST/NEXT) clause outside any parentheses, or null.
     */
    LimitClause topLevelLimit() {
        LimitClause found = lastTopLevel(TOP_LEVEL_LIMIT.matcher(masked));
        return found != null ? found : lastTopLevel(TOP_LEVEL_FETCH.matcher(masked));
    }

    private LimitClause lastTopLevel(Matcher m) {
        LimitClause last = null;
        while (m.find()) {
            if (depth[m.start()] == 0) {
                String value = m.group(1);
                Integer n = value.equalsIgnoreCase("ALL") ? null : parseOrMax(value);
                last = new LimitClause(m.start(1), m.end(1), n);
            }
        }
        return last;
    }

    private static Integer parseOrMax(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            // longer than an int: treat as unbounded, it will be clamped
            return Integer.MAX_VALUE;
        }
    }

    String replace(LimitClause clause, int newValue) {
        return original.substring(0, clause.valueStart()) + newValue + original.substring(clause.valueEnd());
    }

    /**
     * Position and value of a row limit; {@code value} is null for LIMIT ALL.
     */
    record LimitClause(int valueStart, int valueEnd, Integer value) {
    }
}

package org.iceforge.pivot.sql;

import java.math.BigDecimal;

public final class SqlLiterals {

    private SqlLiterals() {
    }

    /**
     * Renders a filter value as a SQL literal. Numbers are unquoted, booleans become
     * TRUE/FALSE and anything else must be a string.
     *
     * @throws IllegalArgumentException for null, non-finite numbers and structured values
     */
    public static String render(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("null is not a valid filter value");
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("non-finite number " + value);
            }
            return BigDecimal.valueOf(d).toPlainString();
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString()).toPlainString();
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof CharSequence s) {
            return quote(s.toString());
        }
        throw new IllegalArgumentException("unsupported filter value type " + value.getClass().getSimpleName());
    }

    public static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}

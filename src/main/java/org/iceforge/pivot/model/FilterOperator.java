package org.iceforge.pivot.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum FilterOperator {
    EQ("="),
    NE("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    IN("IN"),
    NOT_IN("NOT IN"),
    BETWEEN("BETWEEN"),
    LIKE("LIKE");

    private final String sql;

    FilterOperator(String sql) {
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }

    public static Optional<FilterOperator> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (normalized.equals("<>")) {
            return Optional.of(NE);
        }
        if (normalized.equals("NOT_IN")) {
            return Optional.of(NOT_IN);
        }
        return Arrays.stream(values())
                .filter(op -> op.sql.equals(normalized))
                .findFirst();
    }
}

package org.iceforge.pivot.drill;

import org.iceforge.pivot.model.Axis;
import org.iceforge.pivot.model.PivotField;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Objects;

/**
 * "This value of this level was expanded on this axis." Numeric values are normalized so
 * 2024 and 2024.0 name the same member; a string "2024" stays a different member.
 */
public record DrillKey(Axis axis, String dimension, String level, Object value) {

    static final Comparator<Object> VALUE_ORDER = DrillKey::compareValues;

    public DrillKey {
        Objects.requireNonNull(axis, "axis");
        Objects.requireNonNull(dimension, "dimension");
        Objects.requireNonNull(level, "level");
        value = normalize(Objects.requireNonNull(value, "value"));
    }

    public PivotField field() {
        return new PivotField(dimension, level);
    }

    static Object normalize(Object value) {
        if (value instanceof BigDecimal bd) {
            return canonical(bd);
        }
        if (value instanceof Number n) {
            return canonical(new BigDecimal(n.toString()));
        }
        if (value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof CharSequence cs) {
            return cs.toString();
        }
        throw new IllegalArgumentException("Drill value must be a string, number or boolean, got "
                + value.getClass().getSimpleName());
    }

    private static BigDecimal canonical(BigDecimal bd) {
        BigDecimal stripped = bd.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private static int compareValues(Object a, Object b) {
        if (a instanceof BigDecimal x && b instanceof BigDecimal y) {
            return x.compareTo(y);
        }
        int byType = Integer.compare(typeRank(a), typeRank(b));
        if (byType != 0) {
            return byType;
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static int typeRank(Object v) {
        if (v instanceof BigDecimal) {
            return 0;
        }
        if (v instanceof Boolean) {
            return 1;
        }
        return 2;
    }
}

package org.iceforge.pivot.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Filter on one level. {@code operator} is free text from the caller and is resolved
 * against {@link FilterOperator} at compile time.
 */
public record PivotFilter(@NotBlank String dimension,
                          @NotBlank String level,
                          String operator,
                          List<@NotNull Object> values) {

    public PivotFilter {
        operator = operator == null ? "=" : operator;
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public PivotField field() {
        return new PivotField(dimension, level);
    }
}

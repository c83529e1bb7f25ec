package org.iceforge.pivot.model;

import jakarta.validation.constraints.NotBlank;

/**
 * A (dimension, level) reference placed on the rows or columns of a pivot.
 */
public record PivotField(@NotBlank String dimension, @NotBlank String level) {

    @Override
    public String toString() {
        return dimension + "/" + level;
    }
}

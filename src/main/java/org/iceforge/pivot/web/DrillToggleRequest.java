package org.iceforge.pivot.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.iceforge.pivot.drill.DrillKey;
import org.iceforge.pivot.model.Axis;

public class DrillToggleRequest {

    @NotNull
    private Axis axis;

    @NotBlank
    private String dimension;

    @NotBlank
    private String level;

    /**
     * Member value as it appears in the result row (string, number or boolean).
     */
    @NotNull
    private Object value;

    public DrillKey toKey() {
        return new DrillKey(axis, dimension, level, value);
    }

    public Axis getAxis() {
        return axis;
    }

    public void setAxis(Axis axis) {
        this.axis = axis;
    }

    public String getDimension() {
        return dimension;
    }

    public void setDimension(String dimension) {
        this.dimension = dimension;
    }

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }
}

package org.iceforge.pivot.model;

import java.util.List;

public class CubeDef {
    private String name;
    private String caption;
    private String factTable;
    private List<DimensionDef> dimensions;
    private List<MeasureDef> measures;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCaption() {
        return caption;
    }

    public void setCaption(String caption) {
        this.caption = caption;
    }

    public String getFactTable() {
        return factTable;
    }

    public void setFactTable(String factTable) {
        this.factTable = factTable;
    }

    public List<DimensionDef> getDimensions() {
        return dimensions;
    }

    public void setDimensions(List<DimensionDef> dimensions) {
        this.dimensions = dimensions;
    }

    public List<MeasureDef> getMeasures() {
        return measures;
    }

    public void setMeasures(List<MeasureDef> measures) {
        this.measures = measures;
    }
}

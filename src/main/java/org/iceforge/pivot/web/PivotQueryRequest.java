package org.iceforge.pivot.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.iceforge.pivot.model.PivotConfig;
import org.iceforge.pivot.model.PivotField;
import org.iceforge.pivot.model.PivotFilter;

import java.util.List;

public class PivotQueryRequest {

    @NotBlank
    private String cubeName;

    @Valid
    private List<@NotNull PivotField> rows;

    @Valid
    private List<@NotNull PivotField> columns;

    /**
     * Measure names, in display order.
     */
    private List<@NotBlank String> measures;

    @Valid
    private List<@NotNull PivotFilter> filters;

    /**
     * Handle from {@code POST /api/drill}; when set, its expansions are applied before compiling.
     */
    private String drillStateId;

    public PivotConfig toConfig() {
        return new PivotConfig(rows, columns, measures, filters);
    }

    public String getCubeName() {
        return cubeName;
    }

    public void setCubeName(String cubeName) {
        this.cubeName = cubeName;
    }

    public List<PivotField> getRows() {
        return rows;
    }

    public void setRows(List<PivotField> rows) {
        this.rows = rows;
    }

    public List<PivotField> getColumns() {
        return columns;
    }

    public void setColumns(List<PivotField> columns) {
        this.columns = columns;
    }

    public List<String> getMeasures() {
        return measures;
    }

    public void setMeasures(List<String> measures) {
        this.measures = measures;
    }

    public List<PivotFilter> getFilters() {
        return filters;
    }

    public void setFilters(List<PivotFilter> filters) {
        this.filters = filters;
    }

    public String getDrillStateId() {
        return drillStateId;
    }

    public void setDrillStateId(String drillStateId) {
        this.drillStateId = drillStateId;
    }
}

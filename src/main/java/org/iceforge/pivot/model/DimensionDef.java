package org.iceforge.pivot.model;

import java.util.List;

public class DimensionDef {
    private String name;
    private String caption;
    private String table;
    private String foreignKey; // fact table column
    private String primaryKey; // dimension table column, defaults to id
    private List<LevelDef> levels;

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

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public String getForeignKey() {
        return foreignKey;
    }

    public void setForeignKey(String foreignKey) {
        this.foreignKey = foreignKey;
    }

    public String getPrimaryKey() {
        return primaryKey;
    }

    public void setPrimaryKey(String primaryKey) {
        this.primaryKey = primaryKey;
    }

    public List<LevelDef> getLevels() {
        return levels;
    }

    public void setLevels(List<LevelDef> levels) {
        this.levels = levels;
    }
}

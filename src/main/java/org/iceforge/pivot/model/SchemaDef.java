package org.iceforge.pivot.model;

import java.util.List;

/**
 * Raw schema document as read from XML or YAML, before validation. Field values are
 * untrusted; {@link org.iceforge.pivot.service.CubeSchemaParser} turns this into {@link Cube}s.
 */
public class SchemaDef {
    private String name;
    private List<CubeDef> cubes;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<CubeDef> getCubes() {
        return cubes;
    }

    public void setCubes(List<CubeDef> cubes) {
        this.cubes = cubes;
    }
}

package org.iceforge.pivot.nl2sql;

import org.iceforge.pivot.config.PivotProperties;
import org.iceforge.pivot.error.SchemaException;
import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.model.Dimension;
import org.iceforge.pivot.model.Level;
import org.iceforge.pivot.model.Measure;
import org.iceforge.pivot.service.CubeRegistry;
import org.iceforge.pivot.sql.SqlIdentifiers;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders cube metadata as the compact text the model sees: fact table, measures with their
 * aggregate, dimensions with their levels, and the join keys.
 */
@Component
public class SchemaSummarizer implements Nl2SqlStage {

    private final CubeRegistry registry;
    private final PivotProperties props;

    public SchemaSummarizer(CubeRegistry registry, PivotProperties props) {
        this.registry = Objects.requireNonNull(registry);
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public Mono<Nl2SqlContext> apply(Nl2SqlContext context) {
        return Mono.fromCallable(() -> {
            List<Cube> cubes = resolve(context.getCubeName());
            context.setCubes(cubes);
            context.setSchemaSummary(summarize(cubes));
            return context;
        });
    }

    /**
     * Summary of one cube, or of every registered cube when {@code cubeName} is null.
     */
    public String describe(String cubeName) {
        return summarize(resolve(cubeName));
    }

    List<Cube> resolve(String cubeName) {
        if (cubeName != null && !cubeName.isBlank()) {
            return List.of(registry.get(cubeName));
        }
        if (registry.isEmpty()) {
            throw new SchemaException("no cube metadata loaded");
        }
        return new ArrayList<>(registry.all());
    }

    String summarize(List<Cube> cubes) {
        return cubes.stream().map(this::describeCube).collect(Collectors.joining("\n\n"));
    }

    private String describeCube(Cube cube) {
        String fact = table(cube.factTable());
        StringBuilder sb = new StringBuilder();
        sb.append("## Cube: ").append(cube.name()).append('\n');
        sb.append("Fact Table: ").append(fact).append('\n');
        sb.append('\n').append("### Measures:").append('\n');
        for (Measure m : cube.measures()) {
            sb.append("  - ").append(m.name()).append(": ")
                    .append(m.aggregator().apply(fact + "." + SqlIdentifiers.quoteIfNeeded(m.column())))
                    .append('\n');
        }
        sb.append('\n').append("### Dimensions:").append('\n');
        List<String> joins = new ArrayList<>();
        for (Dimension d : cube.dimensions()) {
            String dimTable = table(d.table());
            sb.append("  - ").append(d.name()).append(" (table: ").append(dimTable).append(")\n");
            for (Level l : d.levels()) {
                sb.append("    - Level: ").append(l.name()).append(" (column: ").append(l.column());
                if (l.ordinalColumn() != null) {
                    sb.append(", ordered by: ").append(l.ordinalColumn());
                }
                sb.append(")\n");
            }
            if (d.foreignKey() != null && !d.table().equals(cube.factTable())) {
                joins.add("  - " + fact + "." + d.foreignKey() + " = " + dimTable + "." + d.primaryKey());
            }
        }
        if (!joins.isEmpty()) {
            sb.append('\n').append("### Joins:").append('\n');
            joins.forEach(j -> sb.append(j).append('\n'));
        }
        return sb.toString().stripTrailing();
    }

    private String table(String name) {
        return SqlIdentifiers.table(name, props.getWarehouseSchema());
    }
}

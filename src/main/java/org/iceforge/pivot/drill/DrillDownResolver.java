package org.iceforge.pivot.drill;

import org.iceforge.pivot.model.Axis;
import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.model.Dimension;
import org.iceforge.pivot.model.Level;
import org.iceforge.pivot.model.PivotConfig;
import org.iceforge.pivot.model.PivotField;
import org.iceforge.pivot.model.PivotFilter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the configuration actually compiled for a pivot with expanded members.
 * <p>
 * For every expanded key (axis, D, L, V) the next level of D is placed right after D/L on
 * that axis and V is added to the drill filter of D/L. All expanded values of one level end
 * up in a single filter ({@code =} for one value, {@code IN} for several) so two expanded
 * siblings never produce a contradictory conjunction.
 * <p>
 * Keys are processed coarsest level first, which lets a key on a level that was itself
 * revealed by a drill take effect. Keys whose level is not on the axis, or that have no
 * finer level (e.g. after a schema re-upload), are ignored.
 */
@Component
public class DrillDownResolver {

    public PivotConfig effectiveConfig(Cube cube, PivotConfig base, DrillState state) {
        if (state == null || state.isEmpty()) {
            return base;
        }
        List<PivotField> rows = new ArrayList<>(base.rows());
        List<PivotField> columns = new ArrayList<>(base.columns());
        Map<PivotField, Set<Object>> drillValues = new LinkedHashMap<>();

        for (DrillKey key : ordered(cube, state)) {
            Optional<Dimension> dim = cube.findDimension(key.dimension());
            if (dim.isEmpty()) {
                continue;
            }
            Optional<Level> next = dim.get().nextLevel(key.level());
            if (next.isEmpty()) {
                continue;
            }
            List<PivotField> axis = key.axis() == Axis.ROW ? rows : columns;
            int idx = axis.indexOf(key.field());
            if (idx < 0) {
                continue;
            }
            PivotField child = new PivotField(key.dimension(), next.get().name());
            if (!axis.contains(child)) {
                axis.add(idx + 1, child);
            }
            drillValues.computeIfAbsent(key.field(), f -> new LinkedHashSet<>()).add(key.value());
        }

        List<PivotFilter> filters = new ArrayList<>(base.filters());
        for (Map.Entry<PivotField, Set<Object>> e : drillValues.entrySet()) {
            List<Object> values = new ArrayList<>(e.getValue());
            values.sort(DrillKey.VALUE_ORDER);
            String op = values.size() == 1 ? "=" : "IN";
            filters.add(new PivotFilter(e.getKey().dimension(), e.getKey().level(), op, values));
        }
        return new PivotConfig(rows, columns, base.measures(), filters);
    }

    private static List<DrillKey> ordered(Cube cube, DrillState state) {
        List<DrillKey> keys = new ArrayList<>(state.expandedKeys());
        keys.sort(Comparator.comparing(DrillKey::axis)
                .thenComparing(DrillKey::dimension)
                .thenComparingInt(k -> cube.findDimension(k.dimension())
                        .map(d -> d.levelIndex(k.level()))
                        .orElse(-1))
                .thenComparing(DrillKey::value, DrillKey.VALUE_ORDER));
        return keys;
    }
}

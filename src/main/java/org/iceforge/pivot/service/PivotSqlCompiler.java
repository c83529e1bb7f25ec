package org.iceforge.pivot.service;

import org.iceforge.pivot.config.PivotProperties;
import org.iceforge.pivot.error.CompileException;
import org.iceforge.pivot.error.CompileException.Reason;
import org.iceforge.pivot.model.CompiledQuery;
import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.model.Dimension;
import org.iceforge.pivot.model.FilterOperator;
import org.iceforge.pivot.model.Level;
import org.iceforge.pivot.model.Measure;
import org.iceforge.pivot.model.PivotConfig;
import org.iceforge.pivot.model.PivotField;
import org.iceforge.pivot.model.PivotFilter;
import org.iceforge.pivot.sql.SqlIdentifiers;
import org.iceforge.pivot.sql.SqlLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles a pivot layout into one aggregate SELECT over the cube's star schema.
 * <p>
 * Output is a pure function of the cube and the config: every collection used while
 * building the statement preserves insertion order, so the same input always yields the
 * same SQL text.
 */
@Service
public class PivotSqlCompiler {

    private static final Logger log = LoggerFactory.getLogger(PivotSqlCompiler.class);

    private final PivotProperties props;

    public PivotSqlCompiler(PivotProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    public CompiledQuery compile(Cube cube, PivotConfig config) {
        Objects.requireNonNull(cube);
        Objects.requireNonNull(config);

        if (config.rows().isEmpty() && config.columns().isEmpty() && config.measures().isEmpty()) {
            throw new CompileException(Reason.EMPTY_SELECTION,
                    "Pivot on cube '" + cube.name() + "' selects no rows, columns or measures");
        }

        // Resolve everything before emitting anything
        List<ResolvedLevel> axisLevels = new ArrayList<>();
        Set<PivotField> seen = new LinkedHashSet<>();
        for (PivotField f : concat(config.rows(), config.columns())) {
            ResolvedLevel rl = resolve(cube, f);
            if (seen.add(f)) {
                axisLevels.add(rl);
            }
        }

        List<Measure> measures = new ArrayList<>();
        for (String name : new LinkedHashSet<>(config.measures())) {
            Measure m = cube.findMeasure(name).orElseThrow(() -> new CompileException(Reason.UNKNOWN_FIELD,
                    "Unknown measure '" + name + "' in cube '" + cube.name() + "'"));
            measures.add(m);
        }

        List<ResolvedFilter> filters = new ArrayList<>();
        for (PivotFilter f : config.filters()) {
            filters.add(resolveFilter(cube, f));
        }

        // Joins: only dimensions that are actually referenced, in first-reference order
        String schema = props.getWarehouseSchema();
        String factRef = SqlIdentifiers.table(cube.factTable(), schema);
        JoinPlan joins = new JoinPlan(cube, factRef, schema);
        for (ResolvedLevel rl : axisLevels) {
            joins.reference(rl.dimension());
        }
        for (ResolvedFilter rf : filters) {
            joins.reference(rf.level().dimension());
        }

        List<String> selectCols = new ArrayList<>();
        List<String> outputColumns = new ArrayList<>();
        List<String> groupByCols = new ArrayList<>();
        List<String> orderByCols = new ArrayList<>();
        for (ResolvedLevel rl : axisLevels) {
            String ref = joins.refFor(rl.dimension());
            String col = ref + "." + SqlIdentifiers.quoteIfNeeded(rl.level().column());
            String alias = (rl.dimension().name() + "_" + rl.level().name()).toLowerCase(Locale.ROOT);
            selectCols.add(col + " AS " + SqlIdentifiers.quoteIfNeeded(alias));
            outputColumns.add(alias);
            groupByCols.add(col);
            if (rl.level().ordinalColumn() != null) {
                orderByCols.add("MIN(" + ref + "." + SqlIdentifiers.quoteIfNeeded(rl.level().ordinalColumn()) + ")");
            } else {
                orderByCols.add(col);
            }
        }

        List<String> measureAliases = new ArrayList<>();
        for (Measure m : measures) {
            String alias = m.name().toLowerCase(Locale.ROOT);
            String expr = m.aggregator().apply(factRef + "." + SqlIdentifiers.quoteIfNeeded(m.column()));
            selectCols.add(expr + " AS " + SqlIdentifiers.quoteIfNeeded(alias));
            outputColumns.add(alias);
            measureAliases.add(alias);
        }

        List<String> where = new ArrayList<>();
        for (ResolvedFilter rf : filters) {
            String col = joins.refFor(rf.level().dimension()) + "." + SqlIdentifiers.quoteIfNeeded(rf.level().level().column());
            where.add(rf.render(col));
        }

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(", ", selectCols)).append("\n")
           .append("FROM ").append(factRef).append("\n");
        for (String join : joins.clauses()) {
            sql.append(join).append("\n");
        }
        if (!where.isEmpty()) {
            sql.append("WHERE ").append(String.join("\n  AND ", where)).append("\n");
        }
        if (!groupByCols.isEmpty()) {
            sql.append("GROUP BY ").append(String.join(", ", groupByCols)).append("\n");
            sql.append("ORDER BY ").append(String.join(", ", orderByCols)).append("\n");
        }
        sql.append("LIMIT ").append(props.getResultLimit());

        log.debug("Compiled pivot on cube '{}': {} level(s), {} measure(s), {} filter(s), {} join(s)",
                cube.name(), axisLevels.size(), measures.size(), filters.size(), joins.clauses().size());
        return new CompiledQuery(cube.name(), sql.toString(), outputColumns, measureAliases);
    }

    private static ResolvedLevel resolve(Cube cube, PivotField f) {
        Dimension dim = cube.findDimension(f.dimension()).orElseThrow(() -> new CompileException(Reason.UNKNOWN_FIELD,
                "Unknown dimension '" + f.dimension() + "' in cube '" + cube.name() + "'"));
        Level level = dim.findLevel(f.level()).orElseThrow(() -> new CompileException(Reason.UNKNOWN_FIELD,
                "Unknown level '" + f.level() + "' in dimension '" + f.dimension() + "' of cube '" + cube.name() + "'"));
        return new ResolvedLevel(dim, level);
    }

    private static ResolvedFilter resolveFilter(Cube cube, PivotFilter f) {
        ResolvedLevel rl = resolve(cube, f.field());
        FilterOperator op = FilterOperator.parse(f.operator()).orElseThrow(() -> new CompileException(
                Reason.UNSUPPORTED_OPERATOR, "Unsupported filter operator '" + f.operator() + "' on " + f.field()));
        if (f.values().isEmpty()) {
            throw new CompileException(Reason.EMPTY_FILTER, "Filter on " + f.field() + " has no values");
        }
        int n = f.values().size();
        switch (op) {
            case GT, GTE, LT, LTE, LIKE -> {
                if (n != 1) {
                    throw new CompileException(Reason.INVALID_FILTER,
                            "Operator " + op.getSql() + " on " + f.field() + " takes exactly one value, got " + n);
                }
            }
            case BETWEEN -> {
                if (n != 2) {
                    throw new CompileException(Reason.INVALID_FILTER,
                            "BETWEEN on " + f.field() + " takes exactly two values, got " + n);
                }
            }
            default -> {
                // =, !=, IN, NOT IN accept any number of values
            }
        }
        List<String> literals = new ArrayList<>(n);
        for (Object v : f.values()) {
            try {
                literals.add(SqlLiterals.render(v));
            } catch (IllegalArgumentException e) {
                throw new CompileException(Reason.INVALID_FILTER, "Invalid value on " + f.field() + ": " + e.getMessage());
            }
        }
        return new ResolvedFilter(rl, op, literals);
    }

    private static List<PivotField> concat(List<PivotField> a, List<PivotField> b) {
        List<PivotField> out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }

    private record ResolvedLevel(Dimension dimension, Level level) {
    }

    private record ResolvedFilter(ResolvedLevel level, FilterOperator op, List<String> literals) {

        String render(String col) {
            return switch (op) {
                case EQ -> literals.size() == 1 ? col + " = " + literals.get(0) : col + " IN (" + list() + ")";
                case NE -> literals.size() == 1 ? col + " <> " + literals.get(0) : col + " NOT IN (" + list() + ")";
                case IN -> col + " IN (" + list() + ")";
                case NOT_IN -> col + " NOT IN (" + list() + ")";
                case BETWEEN -> col + " BETWEEN " + literals.get(0) + " AND " + literals.get(1);
                default -> col + " " + op.getSql() + " " + literals.get(0);
            };
        }

        private String list() {
            return String.join(", ", literals);
        }
    }

    /**
     * INNER JOINs from the fact table, one per distinct (table, foreign key). A table joined
     * through two different foreign keys gets a numbered alias the second time.
     */
    private static final class JoinPlan {
        private final Cube cube;
        private final String factRef;
        private final String schema;
        private final Map<String, String> refByJoinKey = new LinkedHashMap<>();
        private final Map<String, Integer> usesByTable = new LinkedHashMap<>();
        private final List<String> clauses = new ArrayList<>();

        JoinPlan(Cube cube, String factRef, String schema) {
            this.cube = cube;
            this.factRef = factRef;
            this.schema = schema;
        }

        void reference(Dimension dim) {
            if (isDegenerate(dim)) {
                return;
            }
            String key = joinKey(dim);
            if (refByJoinKey.containsKey(key)) {
                return;
            }
            String tableRef = SqlIdentifiers.table(dim.table(), schema);
            int uses = usesByTable.merge(dim.table(), 1, Integer::sum);
            String ref = tableRef;
            String clause = "INNER JOIN " + tableRef;
            if (uses > 1) {
                ref = SqlIdentifiers.quoteIfNeeded(SqlIdentifiers.baseName(dim.table()) + "_" + uses);
                clause += " AS " + ref;
            }
            clause += " ON " + factRef + "." + SqlIdentifiers.quoteIfNeeded(dim.foreignKey())
                    + " = " + ref + "." + SqlIdentifiers.quoteIfNeeded(dim.primaryKey());
            refByJoinKey.put(key, ref);
            clauses.add(clause);
        }

        String refFor(Dimension dim) {
            if (isDegenerate(dim)) {
                return factRef;
            }
            return refByJoinKey.get(joinKey(dim));
        }

        List<String> clauses() {
            return clauses;
        }

        private boolean isDegenerate(Dimension dim) {
            return dim.table().equals(cube.factTable());
        }

        private static String joinKey(Dimension dim) {
            return dim.table() + "|" + dim.foreignKey();
        }
    }
}

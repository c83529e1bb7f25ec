package org.iceforge.pivot.service;

import org.iceforge.pivot.config.PivotProperties;
import org.iceforge.pivot.drill.DrillDownResolver;
import org.iceforge.pivot.drill.DrillState;
import org.iceforge.pivot.drill.DrillStateStore;
import org.iceforge.pivot.model.CompiledQuery;
import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.model.PivotConfig;
import org.iceforge.pivot.warehouse.QueryResult;
import org.iceforge.pivot.warehouse.WarehouseExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Pivot path: resolve the cube, apply the drill state if one is named, compile and run.
 */
@Service
public class PivotQueryService {

    private static final Logger log = LoggerFactory.getLogger(PivotQueryService.class);

    private final CubeRegistry registry;
    private final PivotSqlCompiler compiler;
    private final DrillDownResolver drillResolver;
    private final DrillStateStore drillStates;
    private final WarehouseExecutor executor;
    private final PivotProperties props;

    public PivotQueryService(CubeRegistry registry,
                             PivotSqlCompiler compiler,
                             DrillDownResolver drillResolver,
                             DrillStateStore drillStates,
                             WarehouseExecutor executor,
                             PivotProperties props) {
        this.registry = Objects.requireNonNull(registry);
        this.compiler = Objects.requireNonNull(compiler);
        this.drillResolver = Objects.requireNonNull(drillResolver);
        this.drillStates = Objects.requireNonNull(drillStates);
        this.executor = Objects.requireNonNull(executor);
        this.props = Objects.requireNonNull(props);
    }

    public CompiledQuery compile(String cubeName, PivotConfig config, String drillStateId) {
        Cube cube = registry.get(cubeName);
        PivotConfig effective = config;
        if (drillStateId != null && !drillStateId.isBlank()) {
            DrillState state = drillStates.get(drillStateId);
            effective = drillResolver.effectiveConfig(cube, config, state);
        }
        return compiler.compile(cube, effective);
    }

    public Mono<QueryResult> query(String cubeName, PivotConfig config, String drillStateId) {
        return Mono.fromCallable(() -> compile(cubeName, config, drillStateId))
                .doOnNext(q -> log.info("Executing pivot on cube {}", q.cube()))
                .flatMap(q -> executor.execute(q.sql(), props.getQueryTimeout()));
    }
}

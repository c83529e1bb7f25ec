package org.iceforge.pivot.web;

import jakarta.validation.Valid;
import org.iceforge.pivot.model.CompiledQuery;
import org.iceforge.pivot.service.PivotQueryService;
import org.iceforge.pivot.warehouse.QueryResult;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Objects;

@RestController
@RequestMapping("/api/pivot")
public class PivotController {

    private final PivotQueryService service;

    public PivotController(PivotQueryService service) {
        this.service = Objects.requireNonNull(service);
    }

    /**
     * Compiles the pivot (with drill expansions when a handle is given) and runs it.
     */
    @PostMapping("/query")
    public Mono<QueryResult> query(@Valid @RequestBody PivotQueryRequest req) {
        return service.query(req.getCubeName(), req.toConfig(), req.getDrillStateId());
    }

    @PostMapping("/preview-sql")
    public Mono<PivotPreviewResponse> previewSql(@Valid @RequestBody PivotQueryRequest req) {
        return Mono.fromCallable(() -> {
            CompiledQuery q = service.compile(req.getCubeName(), req.toConfig(), req.getDrillStateId());
            return new PivotPreviewResponse(q.sql(), q.columns(), q.measureAliases());
        });
    }
}

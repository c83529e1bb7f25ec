package org.iceforge.pivot.web;

import jakarta.validation.Valid;
import org.iceforge.pivot.nl2sql.Nl2SqlPipeline;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Objects;

@RestController
@RequestMapping("/api/nl2sql")
public class NaturalQueryController {

    private final Nl2SqlPipeline pipeline;

    public NaturalQueryController(Nl2SqlPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline);
    }

    @PostMapping
    public Mono<Nl2SqlResponse> ask(@Valid @RequestBody NaturalQueryRequest req) {
        return pipeline.run(req.getQuestion(), req.getCubeName()).map(Nl2SqlResponse::of);
    }

    /**
     * Generates and validates the statement without running it.
     */
    @PostMapping("/preview")
    public Mono<Nl2SqlResponse> preview(@Valid @RequestBody NaturalQueryRequest req) {
        return pipeline.preview(req.getQuestion(), req.getCubeName()).map(Nl2SqlResponse::of);
    }
}

package org.iceforge.pivot.web;

import jakarta.validation.Valid;
import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.nl2sql.SchemaSummarizer;
import org.iceforge.pivot.service.CubeRegistry;
import org.iceforge.pivot.service.CubeSchemaGenerator;
import org.iceforge.pivot.service.GeneratedSchema;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api/cubes")
public class CubeController {

    private final CubeRegistry registry;
    private final SchemaSummarizer summarizer;
    private final CubeSchemaGenerator generator;

    public CubeController(CubeRegistry registry, SchemaSummarizer summarizer, CubeSchemaGenerator generator) {
        this.registry = Objects.requireNonNull(registry);
        this.summarizer = Objects.requireNonNull(summarizer);
        this.generator = Objects.requireNonNull(generator);
    }

    @GetMapping
    public Map<String, List<String>> list() {
        return Map.of("cubes", registry.list());
    }

    @GetMapping("/{name}")
    public Mono<Cube> get(@PathVariable String name) {
        return Mono.fromCallable(() -> registry.get(name));
    }

    /**
     * The text the NL2SQL prompt embeds for this cube.
     */
    @GetMapping("/{name}/schema-description")
    public Mono<Map<String, String>> schemaDescription(@PathVariable String name) {
        return Mono.fromCallable(() -> Map.of("cube", name, "description", summarizer.describe(name)));
    }

    /**
     * Drafts a schema from a description. Nothing is registered; upload the returned XML to use it.
     */
    @PostMapping("/generate")
    public Mono<GeneratedSchema> generate(@Valid @RequestBody CubeGenerateRequest req) {
        return generator.generate(req.getDescription());
    }
}

package org.iceforge.pivot.web;

import org.iceforge.pivot.service.CubeRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final CubeRegistry registry;

    public HealthController(CubeRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    @GetMapping
    public Map<String, Object> health() {
        return Map.of("status", "ok", "cubes", registry.list().size());
    }
}

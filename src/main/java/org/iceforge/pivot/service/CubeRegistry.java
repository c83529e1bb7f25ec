package org.iceforge.pivot.service;

import org.iceforge.pivot.error.CubeNotFoundException;
import org.iceforge.pivot.model.Cube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds every registered cube, keyed by exact (case-sensitive) name.
 * <p>
 * The registry is an immutable map behind an atomic reference: a registration builds a new
 * map and swaps it in, so readers always see either the old or the new set of cubes and never
 * a half-applied upload. Reads take no lock.
 */
@Component
public class CubeRegistry {

    private static final Logger log = LoggerFactory.getLogger(CubeRegistry.class);

    private final AtomicReference<Map<String, Cube>> snapshot = new AtomicReference<>(Map.of());

    public Cube get(String cubeName) {
        return find(cubeName).orElseThrow(() -> new CubeNotFoundException(cubeName));
    }

    public Optional<Cube> find(String cubeName) {
        if (cubeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get().get(cubeName));
    }

    /**
     * Cube names in registration order.
     */
    public List<String> list() {
        return List.copyOf(snapshot.get().keySet());
    }

    public Collection<Cube> all() {
        return snapshot.get().values();
    }

    public boolean isEmpty() {
        return snapshot.get().isEmpty();
    }

    /**
     * Registers every cube of one parsed document in a single swap, replacing cubes of the same name.
     */
    public void registerAll(Collection<Cube> cubes) {
        snapshot.updateAndGet(current -> {
            Map<String, Cube> next = new LinkedHashMap<>(current);
            for (Cube cube : cubes) {
                next.put(cube.name(), cube);
            }
            return Collections.unmodifiableMap(next);
        });
        log.info("Registered cubes {}", cubes.stream().map(Cube::name).toList());
    }

    public void register(Cube cube) {
        registerAll(List.of(cube));
    }

    public void clear() {
        snapshot.set(Map.of());
        log.info("Cleared cube registry");
    }
}

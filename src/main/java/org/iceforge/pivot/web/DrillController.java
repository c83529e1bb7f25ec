package org.iceforge.pivot.web;

import jakarta.validation.Valid;
import org.iceforge.pivot.drill.DrillStateStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Drill states held server side under an opaque handle. The handle is passed back as
 * {@code drillStateId} on pivot requests.
 */
@RestController
@RequestMapping("/api/drill")
public class DrillController {

    private final DrillStateStore store;

    public DrillController(DrillStateStore store) {
        this.store = Objects.requireNonNull(store);
    }

    @PostMapping
    public DrillStateResponse create() {
        String id = store.create();
        return DrillStateResponse.of(id, store.get(id));
    }

    @GetMapping("/{id}")
    public Mono<DrillStateResponse> get(@PathVariable String id) {
        return Mono.fromCallable(() -> DrillStateResponse.of(id, store.get(id)));
    }

    @PostMapping("/{id}/toggle")
    public Mono<DrillStateResponse> toggle(@PathVariable String id, @Valid @RequestBody DrillToggleRequest req) {
        return Mono.fromCallable(() -> DrillStateResponse.of(id, store.toggle(id, req.toKey())));
    }

    @PostMapping("/{id}/reset")
    public Mono<DrillStateResponse> reset(@PathVariable String id) {
        return Mono.fromCallable(() -> DrillStateResponse.of(id, store.reset(id)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String id) {
        return Mono.fromRunnable(() -> store.remove(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}

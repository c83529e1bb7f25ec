package org.iceforge.pivot.drill;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.iceforge.pivot.config.PivotProperties;
import org.iceforge.pivot.error.DrillStateNotFoundException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ConcurrentMap;

/**
 * Caller-held drill states, one per opaque handle (typically one per UI pivot view).
 * Toggles on one handle are applied atomically; handles never share state.
 * <p>
 * Handles idle for longer than {@code cube.drill-state-ttl}, or pushed out once
 * {@code cube.drill-state-max-entries} is reached, are dropped and then behave exactly like
 * unknown handles.
 */
@Component
public class DrillStateStore {

    private final Cache<String, DrillState> states;

    @Autowired
    public DrillStateStore(PivotProperties props) {
        this(props.getDrillStateTtl(), props.getDrillStateMaxEntries(), Ticker.systemTicker());
    }

    DrillStateStore(Duration ttl, long maxEntries, Ticker ticker) {
        this.states = CacheBuilder.newBuilder()
                .expireAfterAccess(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .build();
    }

    public String create() {
        String id = UUID.randomUUID().toString();
        states.put(id, DrillState.empty());
        return id;
    }

    public DrillState get(String id) {
        DrillState state = id == null ? null : states.getIfPresent(id);
        if (state == null) {
            throw new DrillStateNotFoundException(id);
        }
        return state;
    }

    public DrillState toggle(String id, DrillKey key) {
        requireId(id);
        DrillState next = map().computeIfPresent(id, (k, current) -> current.toggle(key));
        if (next == null) {
            throw new DrillStateNotFoundException(id);
        }
        return next;
    }

    public DrillState reset(String id) {
        requireId(id);
        DrillState next = map().computeIfPresent(id, (k, current) -> DrillState.empty());
        if (next == null) {
            throw new DrillStateNotFoundException(id);
        }
        return next;
    }

    public void remove(String id) {
        requireId(id);
        if (map().remove(id) == null) {
            throw new DrillStateNotFoundException(id);
        }
    }

    long size() {
        states.cleanUp();
        return states.size();
    }

    private ConcurrentMap<String, DrillState> map() {
        return states.asMap();
    }

    private static void requireId(String id) {
        if (id == null) {
            throw new DrillStateNotFoundException(null);
        }
    }
}

package org.iceforge.pivot.warehouse;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Runs an already validated statement against the warehouse.
 * <p>
 * Implementations must fail with {@link org.iceforge.pivot.error.ExecutionTimeoutException}
 * once {@code timeout} elapses and must cancel the running statement when the subscription
 * is cancelled.
 */
public interface WarehouseExecutor {

    Mono<QueryResult> execute(String sql, Duration timeout);
}

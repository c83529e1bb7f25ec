package org.iceforge.pivot.nl2sql;

import reactor.core.publisher.Mono;

/**
 * One step of the natural-language pipeline. A stage either completes with the context it
 * was given, enriched with its own output, or errors, which ends the request.
 */
public interface Nl2SqlStage {

    Mono<Nl2SqlContext> apply(Nl2SqlContext context);
}

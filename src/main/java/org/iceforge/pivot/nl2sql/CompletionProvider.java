package org.iceforge.pivot.nl2sql;

import reactor.core.publisher.Mono;

/**
 * Language model behind the pipeline. Failures surface as
 * {@link org.iceforge.pivot.error.LlmException}.
 */
public interface CompletionProvider {

    Mono<String> complete(String prompt);
}

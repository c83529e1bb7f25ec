package org.iceforge.pivot.nl2sql;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Objects;

@Component
public class CompletionStage implements Nl2SqlStage {

    private final CompletionProvider provider;

    public CompletionStage(CompletionProvider provider) {
        this.provider = Objects.requireNonNull(provider);
    }

    @Override
    public Mono<Nl2SqlContext> apply(Nl2SqlContext context) {
        return provider.complete(context.getPrompt())
                .map(text -> {
                    context.setCompletion(text);
                    return context;
                });
    }
}

package org.iceforge.pivot.nl2sql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Question in, rows out: summarize, prompt, complete, extract, validate, execute.
 * The stage order is fixed and the first failing stage ends the request.
 */
@Service
public class Nl2SqlPipeline {

    private static final Logger log = LoggerFactory.getLogger(Nl2SqlPipeline.class);

    private final List<Nl2SqlStage> previewStages;
    private final List<Nl2SqlStage> stages;

    public Nl2SqlPipeline(SchemaSummarizer summarizer,
                          PromptAssembler promptAssembler,
                          CompletionStage completion,
                          SqlExtractor extractor,
                          ValidationStage validation,
                          ExecutionStage execution) {
        this.previewStages = List.of(summarizer, promptAssembler, completion, extractor, validation);
        this.stages = List.of(summarizer, promptAssembler, completion, extractor, validation, execution);
    }

    public Mono<Nl2SqlContext> run(String question, String cubeName) {
        return chain(stages, new Nl2SqlContext(question, cubeName));
    }

    /**
     * Everything up to and including validation; the statement is never executed.
     */
    public Mono<Nl2SqlContext> preview(String question, String cubeName) {
        return chain(previewStages, new Nl2SqlContext(question, cubeName));
    }

    private Mono<Nl2SqlContext> chain(List<Nl2SqlStage> pipeline, Nl2SqlContext context) {
        Mono<Nl2SqlContext> result = Mono.just(context);
        for (Nl2SqlStage stage : pipeline) {
            result = result.flatMap(stage::apply);
        }
        return result
                .doOnSubscribe(s -> log.info("NL2SQL request on cube {}", context.getCubeName() == null ? "<all>" : context.getCubeName()))
                .doOnSuccess(c -> log.debug("NL2SQL produced: {}", c.getValidated() == null ? null : c.getValidated().sql()))
                .doOnError(e -> log.warn("NL2SQL request failed: {}", e.getMessage()));
    }
}

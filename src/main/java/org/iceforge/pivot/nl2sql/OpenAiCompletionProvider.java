package org.iceforge.pivot.nl2sql;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.pivot.config.PivotProperties;
import org.iceforge.pivot.error.LlmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Chat-completions client for any OpenAI-compatible endpoint. One request per prompt,
 * temperature 0, no retry.
 */
@Component
public class OpenAiCompletionProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompletionProvider.class);

    private final WebClient webClient;
    private final PivotProperties props;

    public OpenAiCompletionProvider(WebClient llmWebClient, PivotProperties props) {
        this.webClient = Objects.requireNonNull(llmWebClient);
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public Mono<String> complete(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getLlmModel());
        body.put("temperature", 0);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        return webClient.post()
                .uri(props.getLlmCompletionPath())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(props.getLlmTimeout())
                .map(this::content)
                .doOnSubscribe(s -> log.debug("Requesting completion from {} with model {}",
                        props.getLlmBaseUrl(), props.getLlmModel()))
                .onErrorMap(e -> !(e instanceof LlmException), this::toLlmException);
    }

    private String content(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new LlmException("Completion response carried no message content");
        }
        return content.asText();
    }

    private LlmException toLlmException(Throwable e) {
        if (e instanceof TimeoutException) {
            return new LlmException("Completion timed out after " + props.getLlmTimeout().toMillis() + " ms", e);
        }
        if (e instanceof WebClientResponseException w) {
            return new LlmException("Completion service returned " + w.getStatusCode().value(), e);
        }
        return new LlmException("Completion request failed: " + e.getMessage(), e);
    }
}

package com.proofsmith.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OpenAiLLMClient - chat completions against an OpenAI-compatible endpoint.
 *
 * Every call goes through {@link RetryPolicy}; the request itself has a hard
 * per-call timeout so a stalled connection counts as a failed attempt.
 */
@Component
@Profile("openai")
public class OpenAiLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLLMClient.class);

    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(120);

    private final WebClient   webClient;
    private final RetryPolicy retryPolicy;

    @Value("${openai.api.key:}")
    private String apiKey;

    @Value("${openai.api.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    public OpenAiLLMClient(WebClient.Builder builder, RetryPolicy retryPolicy) {
        this.webClient   = builder.build();
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String complete(LLMRequest request) {

        log.debug("[OpenAI] role={} model={} temperature={} promptLen={}",
                request.getRole(), request.getModel(), request.getTemperature(), request.promptLength());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",       request.getModel());
        body.put("messages",    request.getMessages().stream()
                .map(ChatMessage::toWire)
                .collect(Collectors.toList()));
        body.put("temperature", request.getTemperature());
        body.put("max_tokens",  request.getMaxTokens());

        return retryPolicy.execute("OpenAI chat " + request.getRole(), () -> {
            Map<?, ?> response = webClient
                    .post()
                    .uri(baseUrl + "/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(CALL_TIMEOUT)
                    .block();

            String text = extractText(response);
            log.debug("[OpenAI] responseLen={}", text.length());
            return text;
        });
    }

    @SuppressWarnings("unchecked")
    private String extractText(Map<?, ?> response) {
        try {
            var choices = (List<Map<String, Object>>) response.get("choices");
            var message = (Map<String, Object>) choices.get(0).get("message");
            Object content = message.get("content");
            return content != null ? content.toString() : "";
        } catch (Exception e) {
            log.error("[OpenAI] Failed to parse response: {}", response, e);
            throw new IllegalStateException("Malformed OpenAI chat response", e);
        }
    }
}

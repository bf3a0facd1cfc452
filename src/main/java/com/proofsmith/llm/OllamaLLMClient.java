package com.proofsmith.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OllamaLLMClient - LLMClient backed by a local Ollama server (/api/chat).
 *
 * The configured {@code ollama.model} replaces the per-stage OpenAI model names,
 * which a local server would not know.
 */
@Component
@Profile("ollama")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:llama3:8b}")
    private String model;

    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RetryPolicy  retryPolicy;

    public OllamaLLMClient(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String complete(LLMRequest request) {

        log.debug("[Ollama] role={} temperature={} promptLen={}",
                request.getRole(), request.getTemperature(), request.promptLength());

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", request.getTemperature());
        options.put("num_predict", request.getMaxTokens());

        Map<String, Object> body = new HashMap<>();
        body.put("model",    model);
        body.put("messages", request.getMessages().stream()
                .map(ChatMessage::toWire)
                .collect(Collectors.toList()));
        body.put("options",  options);
        body.put("stream",   false);

        return retryPolicy.execute("Ollama chat " + request.getRole(), () -> callOllama(body));
    }

    private String callOllama(Map<String, Object> body) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/api/chat", new HttpEntity<>(body, headers), String.class);

            JsonNode root    = objectMapper.readTree(response.getBody());
            JsonNode message = root.path("message");

            String result = message.has("content") ? message.get("content").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (Exception e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new IllegalStateException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }
}

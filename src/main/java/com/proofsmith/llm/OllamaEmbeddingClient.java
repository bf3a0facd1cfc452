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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Embeddings from a local Ollama server (/api/embed). The model comes from the caller;
 * the ollama profile points {@code proofsmith.index.embedding-model} at
 * {@code ollama.embedding-model}, so the index records the model that built it.
 */
@Component
@Profile("ollama")
public class OllamaEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingClient.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RetryPolicy  retryPolicy;

    public OllamaEmbeddingClient(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    @Override
    public List<float[]> embed(String model, List<String> inputs) {
        if (inputs.isEmpty()) return List.of();
        return retryPolicy.execute("Ollama embeddings", () -> callOllama(model, inputs));
    }

    private List<float[]> callOllama(String model, List<String> inputs) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            Map<String, Object> body = Map.of("model", model, "input", inputs);

            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/api/embed", new HttpEntity<>(body, headers), String.class);

            JsonNode embeddings = objectMapper.readTree(response.getBody()).path("embeddings");

            List<float[]> vectors = new ArrayList<>();
            for (JsonNode row : embeddings) {
                float[] vector = new float[row.size()];
                for (int i = 0; i < vector.length; i++) {
                    vector[i] = (float) row.get(i).asDouble();
                }
                vectors.add(vector);
            }

            if (vectors.size() != inputs.size()) {
                throw new IllegalStateException(
                        "Expected " + inputs.size() + " embeddings, got " + vectors.size());
            }
            return vectors;

        } catch (Exception e) {
            log.error("[Ollama] Embedding call failed: {}", e.getMessage());
            throw new IllegalStateException("Ollama embedding call failed: " + e.getMessage(), e);
        }
    }
}

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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Component
@Profile("openai")
public class OpenAiEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingClient.class);

    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(60);

    private final WebClient   webClient;
    private final RetryPolicy retryPolicy;

    @Value("${openai.api.key:}")
    private String apiKey;

    @Value("${openai.api.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    public OpenAiEmbeddingClient(WebClient.Builder builder, RetryPolicy retryPolicy) {
        this.webClient   = builder.build();
        this.retryPolicy = retryPolicy;
    }

    @Override
    public List<float[]> embed(String model, List<String> inputs) {
        if (inputs.isEmpty()) return List.of();

        log.debug("[OpenAI] Embedding {} input(s) with {}", inputs.size(), model);

        Map<String, Object> body = Map.of("model", model, "input", inputs);

        return retryPolicy.execute("OpenAI embeddings", () -> {
            Map<?, ?> response = webClient
                    .post()
                    .uri(baseUrl + "/embeddings")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(CALL_TIMEOUT)
                    .block();
            return extractVectors(response, inputs.size());
        });
    }

    @SuppressWarnings("unchecked")
    private List<float[]> extractVectors(Map<?, ?> response, int expected) {
        try {
            var data = new ArrayList<>((List<Map<String, Object>>) response.get("data"));
            data.sort(Comparator.comparingInt(d -> ((Number) d.get("index")).intValue()));

            List<float[]> vectors = new ArrayList<>(data.size());
            for (Map<String, Object> item : data) {
                List<Number> values = (List<Number>) item.get("embedding");
                float[] vector = new float[values.size()];
                for (int i = 0; i < vector.length; i++) {
                    vector[i] = values.get(i).floatValue();
                }
                vectors.add(vector);
            }

            if (vectors.size() != expected) {
                throw new IllegalStateException(
                        "Expected " + expected + " embeddings, got " + vectors.size());
            }
            return vectors;

        } catch (ClassCastException | NullPointerException e) {
            log.error("[OpenAI] Failed to parse embedding response", e);
            throw new IllegalStateException("Malformed OpenAI embedding response", e);
        }
    }
}

package com.proofsmith.llm;

import java.util.List;

/**
 * Embedding capability of the generative service.
 *
 * Returns one vector per input, in input order. All vectors from one model share a
 * fixed dimensionality. Failures surface as {@link LLMTransportException}.
 */
public interface EmbeddingClient {

    List<float[]> embed(String model, List<String> inputs);

    default float[] embedOne(String model, String input) {
        List<float[]> vectors = embed(model, List.of(input));
        if (vectors.isEmpty()) {
            throw new LLMTransportException("Embedding provider returned no vector");
        }
        return vectors.get(0);
    }
}

package com.proofsmith.llm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline embedding: bag-of-tokens feature hashing into a fixed number of buckets,
 * L2-normalised. Identical text always maps to the identical vector, and texts that
 * share tokens get positive cosine similarity.
 */
@Component
@Profile("mock")
public class HashingEmbeddingClient implements EmbeddingClient {

    private final int dimension;

    public HashingEmbeddingClient(@Value("${proofsmith.index.embedding-dimension:1536}") int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive, got " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(String model, List<String> inputs) {
        List<float[]> vectors = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            vectors.add(hash(input));
        }
        return vectors;
    }

    private float[] hash(String text) {
        float[] vector = new float[dimension];
        for (String token : tokenize(text)) {
            int bucket = Math.floorMod(token.hashCode(), dimension);
            vector[bucket] += 1.0f;
        }

        double norm = 0.0;
        for (float v : vector) norm += v * v;
        if (norm == 0.0) return vector;

        float inv = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) vector[i] *= inv;
        return vector;
    }

    private static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        String s = text.toLowerCase(Locale.ROOT);

        StringBuilder b = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            b.append(Character.isLetterOrDigit(c) || c == '_' ? c : ' ');
        }

        List<String> out = new ArrayList<>();
        for (String p : b.toString().trim().split("\\s+")) {
            if (!p.isBlank()) out.add(p);
        }
        return out;
    }
}

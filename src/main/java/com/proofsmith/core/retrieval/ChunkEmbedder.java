package com.proofsmith.core.retrieval;

import com.proofsmith.llm.EmbeddingClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeds chunks in fixed-size batches. A batch whose call fails, or returns the wrong
 * number of vectors, is replaced by zero vectors so indices stay aligned and every row
 * has the same length.
 */
public class ChunkEmbedder {

    private static final Logger log = LoggerFactory.getLogger(ChunkEmbedder.class);

    static final String DIMENSION_SAMPLE = "Lean 4";

    private final EmbeddingClient embeddingClient;
    private final String          model;
    private final int             dimension;
    private final int             batchSize;

    public ChunkEmbedder(EmbeddingClient embeddingClient, String model, int dimension, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batch-size must be positive, got " + batchSize);
        }
        this.embeddingClient = embeddingClient;
        this.model           = model;
        this.dimension       = dimension;
        this.batchSize       = batchSize;
    }

    public List<float[]> embed(List<Chunk> chunks) {
        return embed(chunks, 0);
    }

    /**
     * Rows of failed batches are zero vectors as wide as the first vector the client
     * returned in this call. When every batch fails, {@code knownDimension} is used if
     * positive, and the configured dimension otherwise.
     */
    public List<float[]> embed(List<Chunk> chunks, int knownDimension) {
        List<float[]> vectors = new ArrayList<>(chunks.size());
        int observed = 0;
        int failed   = 0;

        for (int start = 0; start < chunks.size(); start += batchSize) {
            List<Chunk> batch = chunks.subList(start, Math.min(chunks.size(), start + batchSize));
            List<String> texts = new ArrayList<>(batch.size());
            for (Chunk chunk : batch) {
                texts.add(chunk.getContent());
            }

            try {
                List<float[]> batchVectors = embeddingClient.embed(model, texts);
                if (batchVectors.size() != batch.size()) {
                    throw new IllegalStateException("expected " + batch.size()
                            + " vector(s), got " + batchVectors.size());
                }
                vectors.addAll(batchVectors);
                if (observed == 0 && !batchVectors.isEmpty()) {
                    observed = batchVectors.get(0).length;
                }
                log.info("[ChunkEmbedder] Processed {}/{} chunks", start + batch.size(), chunks.size());

            } catch (RuntimeException e) {
                log.warn("[ChunkEmbedder] Batch at {} failed: {} - using zero vectors", start, e.getMessage());
                for (int i = 0; i < batch.size(); i++) {
                    vectors.add(null);
                }
                failed += batch.size();
            }
        }

        if (failed > 0) {
            int width = observed > 0 ? observed : knownDimension > 0 ? knownDimension : dimension;
            for (int i = 0; i < vectors.size(); i++) {
                if (vectors.get(i) == null) {
                    vectors.set(i, new float[width]);
                }
            }
        }
        return vectors;
    }

    /**
     * Row length the client returns right now, or 0 when it cannot be reached.
     */
    public int liveDimension() {
        try {
            return embedQuery(DIMENSION_SAMPLE).length;
        } catch (RuntimeException e) {
            log.warn("[ChunkEmbedder] Dimension check failed: {}", e.getMessage());
            return 0;
        }
    }

    public float[] embedQuery(String query) {
        return embeddingClient.embedOne(model, query);
    }

    public String getModel() {
        return model;
    }
}

package com.proofsmith.core.retrieval;

/** A chunk paired with its cosine similarity to the query. Never persisted. */
public final class SearchResult {

    private final Chunk  chunk;
    private final double similarity;

    public SearchResult(Chunk chunk, double similarity) {
        this.chunk      = chunk;
        this.similarity = similarity;
    }

    public Chunk getChunk() { return chunk; }

    public double getSimilarity() { return similarity; }

    public String getContent() { return chunk.getContent(); }

    public String getSource() { return chunk.getSource(); }

    @Override
    public String toString() {
        return String.format("SearchResult{#%d, similarity=%.4f}", chunk.getId(), similarity);
    }
}

package com.proofsmith.core.retrieval;

import java.util.List;

/**
 * Chunks and their vectors as read from or written to disk. Row {@code i} of
 * {@code vectors} belongs to chunk {@code i}.
 */
public final class IndexSnapshot {

    private final List<Chunk>   chunks;
    private final List<float[]> vectors;
    private final IndexMetadata metadata;

    public IndexSnapshot(List<Chunk> chunks, List<float[]> vectors, IndexMetadata metadata) {
        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException(
                    "chunk/vector count mismatch: " + chunks.size() + " vs " + vectors.size());
        }
        this.chunks   = List.copyOf(chunks);
        this.vectors  = List.copyOf(vectors);
        this.metadata = metadata;
    }

    public List<Chunk> getChunks() { return chunks; }

    public List<float[]> getVectors() { return vectors; }

    public IndexMetadata getMetadata() { return metadata; }

    public int size() { return chunks.size(); }
}

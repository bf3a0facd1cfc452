package com.proofsmith.core.retrieval;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-width character windows with overlap. Window {@code i} starts at
 * {@code i * (chunkSize - overlap)}; windows that are blank after trimming are dropped.
 * Window text itself is kept untrimmed.
 */
public class DocumentChunker {

    private final int chunkSize;
    private final int overlap;

    public DocumentChunker(int chunkSize, int overlap) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunk-size must be positive, got " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap-size must be in [0, chunk-size), got " + overlap + " for chunk-size " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.overlap   = overlap;
    }

    /**
     * @param firstId id assigned to the first produced chunk; later ones count up from it
     */
    public List<Chunk> split(List<SourceDocument> documents, int firstId) {
        List<Chunk> chunks = new ArrayList<>();
        int step = chunkSize - overlap;

        for (SourceDocument doc : documents) {
            String content = doc.getContent();
            for (int start = 0; start < content.length(); start += step) {
                String window = content.substring(start, Math.min(content.length(), start + chunkSize));
                if (!window.isBlank()) {
                    chunks.add(new Chunk(window, doc.getSource(), doc.getSection(), firstId + chunks.size()));
                }
            }
        }
        return chunks;
    }

    public int getChunkSize() { return chunkSize; }

    public int getOverlap() { return overlap; }
}

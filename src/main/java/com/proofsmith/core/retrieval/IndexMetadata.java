package com.proofsmith.core.retrieval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of {@code metadata.json}. {@code embeddingDimension} is the row length of the
 * stored vectors, 0 for an empty index or a file written before it was recorded.
 */
public final class IndexMetadata {

    private final int    numChunks;
    private final String embeddingModel;
    private final int    embeddingDimension;
    private final int    chunkSize;
    private final int    overlapSize;

    @JsonCreator
    public IndexMetadata(@JsonProperty("num_chunks") int numChunks,
                         @JsonProperty("embedding_model") String embeddingModel,
                         @JsonProperty("embedding_dimension") int embeddingDimension,
                         @JsonProperty("chunk_size") int chunkSize,
                         @JsonProperty("overlap_size") int overlapSize) {
        this.numChunks          = numChunks;
        this.embeddingModel     = embeddingModel;
        this.embeddingDimension = embeddingDimension;
        this.chunkSize          = chunkSize;
        this.overlapSize        = overlapSize;
    }

    @JsonProperty("num_chunks")
    public int getNumChunks() { return numChunks; }

    @JsonProperty("embedding_model")
    public String getEmbeddingModel() { return embeddingModel; }

    @JsonProperty("embedding_dimension")
    public int getEmbeddingDimension() { return embeddingDimension; }

    @JsonProperty("chunk_size")
    public int getChunkSize() { return chunkSize; }

    @JsonProperty("overlap_size")
    public int getOverlapSize() { return overlapSize; }
}

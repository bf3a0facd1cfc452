package com.proofsmith.core.retrieval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable slice of a source document. {@code id} is the chunk's position in the
 * index and is unique within it.
 */
public final class Chunk {

    private final String content;
    private final String source;
    private final int    section;
    private final int    id;

    @JsonCreator
    public Chunk(@JsonProperty("content") String content,
                 @JsonProperty("source") String source,
                 @JsonProperty("section") int section,
                 @JsonProperty("chunk_id") int id) {
        this.content = content != null ? content : "";
        this.source  = source != null ? source : "";
        this.section = section;
        this.id      = id;
    }

    @JsonProperty("content")
    public String getContent() { return content; }

    @JsonProperty("source")
    public String getSource() { return source; }

    @JsonProperty("section")
    public int getSection() { return section; }

    @JsonProperty("chunk_id")
    public int getId() { return id; }

    @Override
    public String toString() {
        return "Chunk{#" + id + ", source=" + source + ", " + content.length() + " chars}";
    }
}

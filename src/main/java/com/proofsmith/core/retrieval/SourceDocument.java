package com.proofsmith.core.retrieval;

/** One {@code <EOC>}-delimited section of a corpus file, or a document added at runtime. */
public final class SourceDocument {

    private final String content;
    private final String source;
    private final int    section;

    public SourceDocument(String content, String source, int section) {
        this.content = content != null ? content : "";
        this.source  = source != null ? source : "";
        this.section = section;
    }

    public String getContent() { return content; }

    public String getSource() { return source; }

    public int getSection() { return section; }
}

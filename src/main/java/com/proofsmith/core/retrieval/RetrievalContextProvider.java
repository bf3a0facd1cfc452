package com.proofsmith.core.retrieval;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** Formats top-k search results as a prompt section. */
@Component
public class RetrievalContextProvider {

    static final String SEPARATOR = "\n---\n";

    private final VectorIndex index;

    public RetrievalContextProvider(VectorIndex index) {
        this.index = index;
    }

    /** Empty string when nothing matches. */
    public String contextFor(String query, int k) {
        List<SearchResult> results = index.search(query, k);
        if (results.isEmpty()) return "";

        List<String> parts = new ArrayList<>(results.size());
        for (SearchResult result : results) {
            parts.add("Source: " + result.getSource() + "\n" + result.getContent() + "\n");
        }
        return String.join(SEPARATOR, parts);
    }
}

package com.proofsmith.core.retrieval;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RetrievalContextProviderTest {

    @Test
    void testResultsAreJoinedWithSourceHeaders() {
        VectorIndex index = mock(VectorIndex.class);
        when(index.search("omega", 2)).thenReturn(List.of(
                new SearchResult(new Chunk("omega closes linear goals", "tactics.txt", 0, 4), 0.9),
                new SearchResult(new Chunk("simp rewrites", "simp.txt", 1, 7), 0.4)));

        String context = new RetrievalContextProvider(index).contextFor("omega", 2);

        assertEquals("Source: tactics.txt\nomega closes linear goals\n"
                + "\n---\n"
                + "Source: simp.txt\nsimp rewrites\n", context);
    }

    @Test
    void testNoResultsGivesEmptyString() {
        VectorIndex index = mock(VectorIndex.class);
        when(index.search("anything", 3)).thenReturn(List.of());

        assertEquals("", new RetrievalContextProvider(index).contextFor("anything", 3));
    }
}

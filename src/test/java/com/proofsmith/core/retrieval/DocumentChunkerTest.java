package com.proofsmith.core.retrieval;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentChunkerTest {

    @Test
    void testWindowsAdvanceBySizeMinusOverlap() {
        DocumentChunker chunker = new DocumentChunker(4, 1);

        List<Chunk> chunks = chunker.split(List.of(new SourceDocument("abcdefghij", "doc.txt", 0)), 0);

        assertEquals(List.of("abcd", "defg", "ghij", "j"),
                chunks.stream().map(Chunk::getContent).toList());
        assertEquals(List.of(0, 1, 2, 3), chunks.stream().map(Chunk::getId).toList());
    }

    @Test
    void testBlankWindowsAreDropped() {
        DocumentChunker chunker = new DocumentChunker(3, 0);

        List<Chunk> chunks = chunker.split(List.of(new SourceDocument("abc      xyz", "d", 0)), 0);

        assertEquals(List.of("abc", "xyz"), chunks.stream().map(Chunk::getContent).toList());
    }

    @Test
    void testIdsContinueFromFirstId() {
        DocumentChunker chunker = new DocumentChunker(10, 2);

        List<Chunk> chunks = chunker.split(List.of(
                new SourceDocument("first document", "a", 0),
                new SourceDocument("second", "b", 1)), 7);

        assertEquals(7, chunks.get(0).getId());
        assertEquals(7 + chunks.size() - 1, chunks.get(chunks.size() - 1).getId());
        assertEquals("b", chunks.get(chunks.size() - 1).getSource());
        assertEquals(1, chunks.get(chunks.size() - 1).getSection());
    }

    @Test
    void testChunkingIsDeterministic() {
        String text = "theorem add_comm (a b : Nat) : a + b = b + a := by omega\n".repeat(40);
        for (int size : new int[] {50, 100, 1000}) {
            for (int overlap : new int[] {0, 10, size - 1}) {
                DocumentChunker chunker = new DocumentChunker(size, overlap);
                List<SourceDocument> docs = List.of(new SourceDocument(text, "t", 0));

                List<String> first  = chunker.split(docs, 0).stream().map(Chunk::getContent).toList();
                List<String> second = chunker.split(docs, 0).stream().map(Chunk::getContent).toList();

                assertEquals(first, second, "size=" + size + " overlap=" + overlap);
            }
        }
    }

    @Test
    void testRejectsOverlapNotSmallerThanSize() {
        assertThrows(IllegalArgumentException.class, () -> new DocumentChunker(100, 100));
        assertThrows(IllegalArgumentException.class, () -> new DocumentChunker(100, 150));
        assertThrows(IllegalArgumentException.class, () -> new DocumentChunker(0, 0));
    }
}

package com.proofsmith.core.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofsmith.llm.EmbeddingClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * VectorIndex - exact top-k cosine search over embedded document chunks.
 *
 * STATE
 *   chunks and vectors are parallel lists; row i of vectors embeds chunk i.
 *   Both only ever grow by append, and their sizes are always equal.
 *
 * LIFECYCLE
 *   Loaded lazily on first search or add. If the store holds a consistent index built
 *   with the configured embedding model, chunking and vector width it is reused;
 *   otherwise the corpus is re-ingested and the result persisted.
 *
 * Every public operation holds the instance lock for its whole duration: load fully,
 * mutate fully, persist fully.
 */
@Component
public class VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(VectorIndex.class);

    private final CorpusLoader    corpusLoader;
    private final DocumentChunker chunker;
    private final ChunkEmbedder   embedder;
    private final IndexStore      store;
    private final int             defaultK;

    private final List<Chunk>   chunks  = new ArrayList<>();
    private final List<float[]> vectors = new ArrayList<>();

    private boolean loaded = false;

    @Autowired
    public VectorIndex(
            EmbeddingClient embeddingClient,
            ObjectMapper objectMapper,
            @Value("${proofsmith.index.documents-dir:documents}") String documentsDir,
            @Value("${proofsmith.index.db-dir:embedding_db}") String dbDir,
            @Value("${proofsmith.index.embedding-model:text-embedding-3-small}") String embeddingModel,
            @Value("${proofsmith.index.embedding-dimension:1536}") int embeddingDimension,
            @Value("${proofsmith.index.chunk-size:1000}") int chunkSize,
            @Value("${proofsmith.index.overlap-size:200}") int overlapSize,
            @Value("${proofsmith.index.batch-size:100}") int batchSize,
            @Value("${proofsmith.index.max-chunks:10}") int maxChunks
    ) {
        this(
                new CorpusLoader(Path.of(documentsDir)),
                new DocumentChunker(chunkSize, overlapSize),
                new ChunkEmbedder(embeddingClient, embeddingModel, embeddingDimension, batchSize),
                new IndexStore(Path.of(dbDir), objectMapper),
                maxChunks
        );
    }

    public VectorIndex(CorpusLoader corpusLoader, DocumentChunker chunker, ChunkEmbedder embedder,
                       IndexStore store, int defaultK) {
        this.corpusLoader = corpusLoader;
        this.chunker      = chunker;
        this.embedder     = embedder;
        this.store        = store;
        this.defaultK     = defaultK;
    }

    // =========================================================================
    // Build / load
    // =========================================================================

    public synchronized void ensureLoaded() {
        if (loaded) return;
        loaded = true;

        if (store.exists()) {
            try {
                IndexSnapshot snapshot = store.load();
                if (isCompatible(snapshot.getMetadata())) {
                    chunks.addAll(snapshot.getChunks());
                    vectors.addAll(snapshot.getVectors());
                    log.info("[VectorIndex] Loaded database with {} chunks", chunks.size());
                    return;
                }
                log.warn("[VectorIndex] Stored index was built with a different model or chunking; rebuilding");
            } catch (IndexStoreException e) {
                log.warn("[VectorIndex] Error loading database: {}; rebuilding", e.getMessage());
            }
        }

        rebuild();
    }

    /**
     * Same model name and chunking, and, when the client can be reached, the same vector
     * width as the client produces now.
     */
    private boolean isCompatible(IndexMetadata metadata) {
        if (metadata == null
                || !embedder.getModel().equals(metadata.getEmbeddingModel())
                || metadata.getChunkSize() != chunker.getChunkSize()
                || metadata.getOverlapSize() != chunker.getOverlap()) {
            return false;
        }
        if (metadata.getEmbeddingDimension() > 0) {
            int live = embedder.liveDimension();
            if (live > 0 && live != metadata.getEmbeddingDimension()) {
                log.warn("[VectorIndex] Stored vectors have dimension {} but the embedder returns {}",
                        metadata.getEmbeddingDimension(), live);
                return false;
            }
        }
        return true;
    }

    private int dimension() {
        return vectors.isEmpty() ? 0 : vectors.get(0).length;
    }

    private void rebuild() {
        log.info("[VectorIndex] Creating new embedding database...");
        chunks.clear();
        vectors.clear();

        List<SourceDocument> documents;
        try {
            documents = corpusLoader.loadOrSeed();
        } catch (IOException e) {
            log.error("[VectorIndex] Could not read corpus: {}; index stays empty", e.getMessage());
            return;
        }

        List<Chunk> built = chunker.split(documents, 0);
        if (built.isEmpty()) {
            log.warn("[VectorIndex] No chunks created; using empty database");
            return;
        }

        chunks.addAll(built);
        vectors.addAll(embedder.embed(built));
        persist();
        log.info("[VectorIndex] Created database with {} chunks", chunks.size());
    }

    private void persist() {
        IndexMetadata metadata = new IndexMetadata(
                chunks.size(), embedder.getModel(), dimension(), chunker.getChunkSize(), chunker.getOverlap());
        try {
            store.save(new IndexSnapshot(chunks, vectors, metadata));
        } catch (IndexStoreException e) {
            log.error("[VectorIndex] Persist failed, continuing in memory: {}", e.getMessage());
        }
    }

    // =========================================================================
    // Operations
    // =========================================================================

    public List<SearchResult> search(String query) {
        return search(query, defaultK);
    }

    /**
     * At most {@code k} results, highest similarity first; equal scores keep insertion
     * order. Empty on an empty index, non-positive k, or any failure.
     */
    public synchronized List<SearchResult> search(String query, int k) {
        if (k <= 0 || query == null) return List.of();

        try {
            ensureLoaded();
            if (chunks.isEmpty()) return List.of();

            float[] queryVector = embedder.embedQuery(query);

            double[] scores = new double[vectors.size()];
            List<Integer> order = new ArrayList<>(vectors.size());
            for (int i = 0; i < vectors.size(); i++) {
                scores[i] = cosine(queryVector, vectors.get(i));
                order.add(i);
            }

            // List.sort is stable
            order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

            List<SearchResult> results = new ArrayList<>(Math.min(k, order.size()));
            for (int i = 0; i < Math.min(k, order.size()); i++) {
                int idx = order.get(i);
                results.add(new SearchResult(chunks.get(idx), scores[idx]));
            }
            return results;

        } catch (RuntimeException e) {
            log.warn("[VectorIndex] Error during search: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Chunks, embeds and appends {@code content}, then persists the whole index.
     *
     * @return number of chunks added
     */
    public synchronized int addDocument(String content, String source) {
        ensureLoaded();

        String src = (source == null || source.isBlank()) ? "user_added" : source;
        List<Chunk> added = chunker.split(List.of(new SourceDocument(content, src, 0)), chunks.size());
        if (added.isEmpty()) {
            log.info("[VectorIndex] Nothing to add from {}", src);
            return 0;
        }

        List<float[]> addedVectors = embedder.embed(added, dimension());
        chunks.addAll(added);
        vectors.addAll(addedVectors);
        persist();

        log.info("[VectorIndex] Added {} new chunks from {}", added.size(), src);
        return added.size();
    }

    public synchronized int size() {
        ensureLoaded();
        return chunks.size();
    }

    /** 0 when either vector has zero norm or the lengths differ. */
    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) return 0.0;

        double dot = 0.0, normA = 0.0, normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot   += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}

package com.proofsmith.core.retrieval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk layout of the vector index, all three files in one directory:
 *
 *   chunks.json     JSON array of chunks
 *   embeddings.bin  int rows, int cols, then rows*cols big-endian floats
 *   metadata.json   {num_chunks, embedding_model, embedding_dimension, chunk_size, overlap_size}
 */
public class IndexStore {

    private static final Logger log = LoggerFactory.getLogger(IndexStore.class);

    static final String CHUNKS_FILE     = "chunks.json";
    static final String EMBEDDINGS_FILE = "embeddings.bin";
    static final String METADATA_FILE   = "metadata.json";

    private static final int MATRIX_HEADER_BYTES = 2 * Integer.BYTES;

    private final Path         dbDir;
    private final ObjectMapper mapper;

    public IndexStore(Path dbDir, ObjectMapper mapper) {
        this.dbDir  = dbDir;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** True when all three files are present. */
    public boolean exists() {
        return Files.isRegularFile(dbDir.resolve(CHUNKS_FILE))
                && Files.isRegularFile(dbDir.resolve(EMBEDDINGS_FILE))
                && Files.isRegularFile(dbDir.resolve(METADATA_FILE));
    }

    public IndexSnapshot load() throws IndexStoreException {
        if (!exists()) {
            throw new IndexStoreException("Index files missing under " + dbDir);
        }

        try {
            List<Chunk> chunks = mapper.readValue(
                    dbDir.resolve(CHUNKS_FILE).toFile(), new TypeReference<List<Chunk>>() {});
            IndexMetadata metadata = mapper.readValue(
                    dbDir.resolve(METADATA_FILE).toFile(), IndexMetadata.class);
            List<float[]> vectors = readMatrix(dbDir.resolve(EMBEDDINGS_FILE));

            if (chunks.size() != vectors.size()) {
                throw new IndexStoreException("Index is inconsistent: " + chunks.size()
                        + " chunk(s) but " + vectors.size() + " vector(s)");
            }
            if (!vectors.isEmpty() && vectors.get(0).length != metadata.getEmbeddingDimension()) {
                throw new IndexStoreException("Index is inconsistent: metadata records dimension "
                        + metadata.getEmbeddingDimension() + " but vectors have " + vectors.get(0).length);
            }

            log.info("[IndexStore] Loaded {} chunk(s) from {}", chunks.size(), dbDir);
            return new IndexSnapshot(chunks, vectors, metadata);

        } catch (IOException e) {
            throw new IndexStoreException("Failed to read index from " + dbDir + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes all three files. The snapshot is checked first, so a rejected snapshot
     * leaves the directory untouched.
     */
    public void save(IndexSnapshot snapshot) throws IndexStoreException {
        int cols = validate(snapshot);

        try {
            Files.createDirectories(dbDir);
            mapper.writeValue(dbDir.resolve(CHUNKS_FILE).toFile(), snapshot.getChunks());
            writeMatrix(dbDir.resolve(EMBEDDINGS_FILE), snapshot.getVectors(), cols);
            mapper.writeValue(dbDir.resolve(METADATA_FILE).toFile(), snapshot.getMetadata());

            log.info("[IndexStore] Saved {} chunk(s) to {}", snapshot.size(), dbDir);

        } catch (IOException e) {
            throw new IndexStoreException("Failed to write index to " + dbDir + ": " + e.getMessage(), e);
        }
    }

    /** @return the common row length */
    private static int validate(IndexSnapshot snapshot) throws IndexStoreException {
        List<float[]> vectors = snapshot.getVectors();
        int cols = vectors.isEmpty() ? 0 : vectors.get(0).length;
        for (int i = 1; i < vectors.size(); i++) {
            if (vectors.get(i).length != cols) {
                throw new IndexStoreException("Ragged matrix: expected " + cols
                        + " columns, row " + i + " has " + vectors.get(i).length);
            }
        }
        return cols;
    }

    private static List<float[]> readMatrix(Path file) throws IOException {
        long fileSize = Files.size(file);

        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            int rows = in.readInt();
            int cols = in.readInt();
            if (rows < 0 || cols < 0) {
                throw new IOException("Corrupt matrix header: " + rows + "x" + cols);
            }
            long expected = MATRIX_HEADER_BYTES + (long) rows * cols * Float.BYTES;
            if (expected != fileSize) {
                throw new IOException("Corrupt matrix header: " + rows + "x" + cols
                        + " needs " + expected + " bytes, file has " + fileSize);
            }

            List<float[]> vectors = new ArrayList<>(rows);
            for (int r = 0; r < rows; r++) {
                float[] row = new float[cols];
                for (int c = 0; c < cols; c++) {
                    row[c] = in.readFloat();
                }
                vectors.add(row);
            }
            return vectors;
        }
    }

    private static void writeMatrix(Path file, List<float[]> vectors, int cols) throws IOException {
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(file)))) {
            out.writeInt(vectors.size());
            out.writeInt(cols);
            for (float[] row : vectors) {
                for (float v : row) {
                    out.writeFloat(v);
                }
            }
        }
    }

    public Path getDbDir() {
        return dbDir;
    }
}

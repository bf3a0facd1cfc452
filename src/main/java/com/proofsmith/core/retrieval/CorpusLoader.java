package com.proofsmith.core.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads {@code *.txt} files from the documents directory, in file-name order, and
 * splits each on the {@code <EOC>} marker.
 */
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    static final String SECTION_MARKER = "<EOC>";

    private final Path documentsDir;

    public CorpusLoader(Path documentsDir) {
        this.documentsDir = documentsDir;
    }

    /**
     * Loads the corpus, writing the built-in seed documents first when the directory
     * holds none. An unreadable file is skipped.
     */
    public List<SourceDocument> loadOrSeed() throws IOException {
        Files.createDirectories(documentsDir);

        List<SourceDocument> documents = load();
        if (documents.isEmpty()) {
            log.info("[CorpusLoader] No documents in {}, writing defaults", documentsDir);
            writeDefaults();
            documents = load();
        }
        return documents;
    }

    public List<SourceDocument> load() throws IOException {
        if (!Files.isDirectory(documentsDir)) {
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> stream = Files.list(documentsDir)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".txt"))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<SourceDocument> documents = new ArrayList<>();
        for (Path file : files) {
            try {
                documents.addAll(sections(Files.readString(file, StandardCharsets.UTF_8), file.toString()));
            } catch (IOException e) {
                log.warn("[CorpusLoader] Skipping {}: {}", file, e.getMessage());
            }
        }

        log.info("[CorpusLoader] Loaded {} section(s) from {} file(s)", documents.size(), files.size());
        return documents;
    }

    static List<SourceDocument> sections(String content, String source) {
        List<SourceDocument> out = new ArrayList<>();
        String[] parts = content.split(SECTION_MARKER, -1);
        for (int i = 0; i < parts.length; i++) {
            String section = parts[i].strip();
            if (!section.isEmpty()) {
                out.add(new SourceDocument(section, source, i));
            }
        }
        return out;
    }

    private void writeDefaults() throws IOException {
        for (Map.Entry<String, String> doc : DefaultDocuments.all().entrySet()) {
            Files.writeString(documentsDir.resolve(doc.getKey()), doc.getValue(), StandardCharsets.UTF_8);
        }
    }
}

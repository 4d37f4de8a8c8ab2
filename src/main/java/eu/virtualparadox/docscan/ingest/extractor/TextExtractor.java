package eu.virtualparadox.docscan.ingest.extractor;

import eu.virtualparadox.docscan.ingest.model.ExtractionResult;

import java.nio.file.Path;

public interface TextExtractor {

    /**
     * Extracts the text of {@code path}, page by page.
     * Implementations never throw for unreadable content; they return a failed result instead.
     */
    ExtractionResult extract(final Path path);

    default String extractText(final Path path) {
        return extract(path).fullText();
    }

}

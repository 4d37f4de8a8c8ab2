package eu.virtualparadox.docscan.ingest.extractor;

import eu.virtualparadox.docscan.ingest.model.DocumentKind;
import eu.virtualparadox.docscan.ingest.model.Page;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Extraction strategy for one {@link DocumentKind}.
 * Strategies may throw; {@link PageAwareTextExtractor} turns failures into empty results.
 */
public interface FormatExtractor {

    DocumentKind kind();

    List<Page> extractPages(final Path path) throws IOException;
}

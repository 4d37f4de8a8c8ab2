package eu.virtualparadox.docscan.ingest.extractor;

import eu.virtualparadox.docscan.ingest.model.DocumentKind;
import eu.virtualparadox.docscan.ingest.model.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Extractor that dispatches a file to the {@link FormatExtractor} of its {@link DocumentKind}
 * and produces an ordered list of pages:
 * <ul>
 *   <li>PDF: one page per physical page, labelled {@code "1".."n"};</li>
 *   <li>word-processor and plain text: a single page labelled {@code "1"}.</li>
 * </ul>
 * <p>Any failure (corrupt file, decoding error, missing format support) is reported as an empty
 * {@link ExtractionResult} with a reason. Nothing is cached: every call reads the file again.</p>
 * <p>Files with an unrecognized extension are read as plain text; they are normally filtered out
 * before reaching this class.</p>
 */
@Service
@Primary
@Slf4j
public final class PageAwareTextExtractor implements TextExtractor {

    private final Map<DocumentKind, FormatExtractor> extractors = new EnumMap<>(DocumentKind.class);

    public PageAwareTextExtractor(final List<FormatExtractor> formatExtractors) {
        for (final FormatExtractor extractor : formatExtractors) {
            if (extractors.putIfAbsent(extractor.kind(), extractor) != null) {
                throw new IllegalArgumentException("Duplicate extractor for " + extractor.kind());
            }
        }
    }

    @Override
    public ExtractionResult extract(final Path path) {
        final DocumentKind kind = DocumentKind.of(path).orElse(DocumentKind.PLAIN_TEXT);
        final FormatExtractor extractor = extractors.get(kind);
        if (extractor == null) {
            log.debug("No extractor available for {} ({})", path, kind);
            return ExtractionResult.failed("no extractor for " + kind);
        }

        try {
            return ExtractionResult.of(extractor.extractPages(path));
        } catch (Exception | LinkageError e) {
            // LinkageError covers optional format libraries missing at runtime
            log.debug("Extraction failed for {}", path, e);
            return ExtractionResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}

package eu.virtualparadox.docscan.compare;

import eu.virtualparadox.docscan.ingest.chunker.ParagraphChunker;
import eu.virtualparadox.docscan.ingest.cleaner.TextNormalizer;
import eu.virtualparadox.docscan.ingest.extractor.TextExtractor;
import eu.virtualparadox.docscan.ingest.model.Chunk;
import eu.virtualparadox.docscan.ingest.model.ExtractionResult;
import eu.virtualparadox.docscan.util.ScoreRounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Paragraph-level structural comparison of one reference document against one target document.
 * <p>
 * Both documents are split into page-attributed chunks by {@link ParagraphChunker}. Every reference
 * chunk of at least {@value #MIN_COMPARABLE_LENGTH} characters is scored against every target chunk
 * of the same minimum length with {@link SequenceSimilarity} on the case-folded, whitespace-stripped
 * texts. Only the best target chunk is kept per reference chunk (the first one on ties), and only
 * scores above {@value #REPORT_THRESHOLD} are reported.
 * </p>
 *
 * <p><strong>Complexity:</strong> {@code O(R * T)} chunk pairs for {@code R} reference and {@code T}
 * target chunks. Runs synchronously on the caller thread; it is meant for a single document pair,
 * never for the whole archive.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChunkComparator {

    static final int MIN_COMPARABLE_LENGTH = 50;
    static final double REPORT_THRESHOLD = 15.0;
    static final int PREVIEW_CHARS = 100;
    static final String NO_PAGE = "-";

    private final TextExtractor textExtractor;
    private final ParagraphChunker paragraphChunker;
    private final TextNormalizer textNormalizer;

    /**
     * @param reference reference document
     * @param target    document searched for the reference's paragraphs
     * @return results sorted by score, highest first; empty if either document has no usable text
     */
    public List<ComparisonResult> compare(final Path reference, final Path target) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(target, "target must not be null");

        final ExtractionResult referenceText = textExtractor.extract(reference);
        final ExtractionResult targetText = textExtractor.extract(target);
        if (referenceText.isEmpty() || targetText.isEmpty()) {
            log.info("Nothing to compare: {} or {} has no extractable text",
                    reference.getFileName(), target.getFileName());
            return List.of();
        }

        final List<Chunk> referenceChunks = paragraphChunker.chunk(referenceText.pages());
        final List<Chunk> targetChunks = paragraphChunker.chunk(targetText.pages());

        final List<Chunk> candidates = new ArrayList<>();
        final List<String> candidateKeys = new ArrayList<>();
        for (final Chunk chunk : targetChunks) {
            if (chunk.length() >= MIN_COMPARABLE_LENGTH) {
                candidates.add(chunk);
                candidateKeys.add(textNormalizer.compress(chunk.text()));
            }
        }

        final List<ComparisonResult> results = new ArrayList<>();
        for (final Chunk chunk : referenceChunks) {
            if (chunk.length() < MIN_COMPARABLE_LENGTH) {
                continue;
            }
            final String key = textNormalizer.compress(chunk.text());

            double bestScore = 0.0;
            String bestPage = NO_PAGE;
            for (int t = 0; t < candidates.size(); t++) {
                final double score = SequenceSimilarity.ratio(key, candidateKeys.get(t)) * 100.0;
                if (score > bestScore) {
                    bestScore = score;
                    bestPage = candidates.get(t).page();
                }
            }

            if (bestScore > REPORT_THRESHOLD) {
                results.add(new ComparisonResult(chunk.page(), bestPage,
                        ScoreRounding.toOneDecimal(bestScore), preview(chunk.text())));
            }
        }

        results.sort(Comparator.comparingDouble(ComparisonResult::score).reversed());
        log.info("Compared {} ({} chunks) with {} ({} chunks): {} aligned paragraphs",
                reference.getFileName(), referenceChunks.size(),
                target.getFileName(), targetChunks.size(), results.size());
        return results;
    }

    private String preview(final String text) {
        return textNormalizer.flattenLines(StringUtils.left(text, PREVIEW_CHARS)) + "...";
    }
}

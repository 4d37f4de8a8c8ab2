package eu.virtualparadox.docscan.scan;

import eu.virtualparadox.docscan.ingest.extractor.TextExtractor;
import eu.virtualparadox.docscan.search.similarity.TokenSimilarityScorer;
import eu.virtualparadox.docscan.util.ScoreRounding;

import java.nio.file.Path;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Extracts one file and scores its token overlap with the precomputed reference tokens.
 * Files without tokens are excluded rather than scored as zero.
 */
final class SimilarityScanJob implements ScanJob {

    private final Path path;
    private final Set<String> referenceTokens;
    private final TextExtractor textExtractor;
    private final TokenSimilarityScorer scorer;

    SimilarityScanJob(final Path path,
                      final Set<String> referenceTokens,
                      final TextExtractor textExtractor,
                      final TokenSimilarityScorer scorer) {
        this.path = path;
        this.referenceTokens = referenceTokens;
        this.textExtractor = textExtractor;
        this.scorer = scorer;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public MatchResult call() {
        final Set<String> targetTokens = scorer.tokenize(textExtractor.extractText(path));
        final OptionalDouble score = scorer.score(referenceTokens, targetTokens);
        if (score.isPresent() && scorer.isReportable(score.getAsDouble())) {
            return MatchResult.similarity(path, ScoreRounding.toOneDecimal(score.getAsDouble()));
        }
        return MatchResult.notFound(path, EScanType.SIMILARITY);
    }
}

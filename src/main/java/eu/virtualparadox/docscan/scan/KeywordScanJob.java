package eu.virtualparadox.docscan.scan;

import eu.virtualparadox.docscan.ingest.extractor.TextExtractor;
import eu.virtualparadox.docscan.search.keyword.KeywordMatcher;
import eu.virtualparadox.docscan.search.keyword.KeywordQuery;
import eu.virtualparadox.docscan.search.keyword.MatchOutcome;

import java.nio.file.Path;

/**
 * Extracts one file and tests it against a keyword query.
 */
final class KeywordScanJob implements ScanJob {

    private final Path path;
    private final KeywordQuery query;
    private final TextExtractor textExtractor;
    private final KeywordMatcher keywordMatcher;

    KeywordScanJob(final Path path,
                   final KeywordQuery query,
                   final TextExtractor textExtractor,
                   final KeywordMatcher keywordMatcher) {
        this.path = path;
        this.query = query;
        this.textExtractor = textExtractor;
        this.keywordMatcher = keywordMatcher;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public MatchResult call() {
        final String text = textExtractor.extractText(path);
        final MatchOutcome outcome = keywordMatcher.match(text, query);
        return outcome.found()
                ? MatchResult.keyword(path, outcome.snippet())
                : MatchResult.notFound(path, EScanType.KEYWORD);
    }
}

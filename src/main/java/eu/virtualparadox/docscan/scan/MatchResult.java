package eu.virtualparadox.docscan.scan;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Self-contained result of one scan job.
 *
 * @param found    whether the file matched
 * @param path     scanned file
 * @param type     kind of search that produced the result
 * @param location {@code "Text"} for keyword hits, the overlap percentage (e.g. {@code "40.0"}) for similarity hits
 * @param score    overlap percentage for similarity hits, {@code 0} otherwise
 * @param context  keyword snippet, or {@code "Content Overlap"} for similarity hits
 */
public record MatchResult(boolean found, Path path, EScanType type, String location, double score, String context) {

    public static final String TEXT_LOCATION = "Text";
    public static final String OVERLAP_CONTEXT = "Content Overlap";

    public static MatchResult keyword(final Path path, final String snippet) {
        return new MatchResult(true, path, EScanType.KEYWORD, TEXT_LOCATION, 0, snippet);
    }

    public static MatchResult similarity(final Path path, final double score) {
        return new MatchResult(true, path, EScanType.SIMILARITY,
                String.format(Locale.ROOT, "%.1f", score), score, OVERLAP_CONTEXT);
    }

    public static MatchResult notFound(final Path path, final EScanType type) {
        return new MatchResult(false, path, type, "", 0, "");
    }
}

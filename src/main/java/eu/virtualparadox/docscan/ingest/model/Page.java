package eu.virtualparadox.docscan.ingest.model;

/**
 * Raw text of one page of a document.
 *
 * @param label 1-based page index rendered as a string; formats without pagination use {@code "1"}
 * @param text  extracted page text, never {@code null}
 */
public record Page(String label, String text) {

    public static final String SINGLE_PAGE = "1";

    public static Page single(final String text) {
        return new Page(SINGLE_PAGE, text);
    }
}

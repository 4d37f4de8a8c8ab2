package eu.virtualparadox.docscan.compare;

/**
 * Best alignment of one reference chunk inside the target document.
 *
 * @param referencePage page label of the reference chunk
 * @param targetPage    page label of the best-scoring target chunk
 * @param score         sequence similarity in percent, one decimal
 * @param preview       first characters of the reference chunk, single line, suffixed with {@code ...}
 */
public record ComparisonResult(String referencePage, String targetPage, double score, String preview) {

}

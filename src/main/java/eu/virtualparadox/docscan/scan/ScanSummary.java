package eu.virtualparadox.docscan.scan;

/**
 * Counters of a finished (or cancelled) search.
 *
 * @param total     number of jobs scheduled
 * @param processed number of job completions handled before the search ended
 * @param matches   number of matches reported
 * @param cancelled whether the search stopped because of cancellation
 */
public record ScanSummary(int total, int processed, int matches, boolean cancelled) {

}

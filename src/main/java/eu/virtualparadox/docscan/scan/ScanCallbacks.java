package eu.virtualparadox.docscan.scan;

/**
 * Notifications emitted by {@link ScanOrchestrator} on the thread that runs the search.
 * Every method is optional; the defaults do nothing.
 */
public interface ScanCallbacks {

    /**
     * A file matched. Results arrive in completion order, not in file-list order.
     */
    default void onMatch(final MatchResult result) {
    }

    /**
     * Fired every {@value ScanProgressTracker#REPORT_EVERY}th completed job and on the last one.
     *
     * @param percent  completed jobs in percent, never decreasing within one search
     * @param fileName file name (without directory) of the job that just completed
     */
    default void onProgress(final int percent, final String fileName) {
    }

    /**
     * Fired exactly once per started search, also after cancellation.
     *
     * @param totalMatches number of matches reported through {@link #onMatch(MatchResult)}
     */
    default void onDone(final int totalMatches) {
    }
}

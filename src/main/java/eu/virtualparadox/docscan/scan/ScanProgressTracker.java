package eu.virtualparadox.docscan.scan;

/**
 * Tracks completed jobs of one search and throttles progress notifications.
 * <p>Progress is reported every {@value #REPORT_EVERY}th completion and always on the final one,
 * so the last reported percentage is exactly 100. Used only from the orchestrating thread.</p>
 */
final class ScanProgressTracker {

    static final int REPORT_EVERY = 5;

    private final int total;
    private final ScanCallbacks callbacks;

    /**
     * Jobs handled so far.
     */
    private int processed;

    ScanProgressTracker(final int total, final ScanCallbacks callbacks) {
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative");
        }
        this.total = total;
        this.callbacks = callbacks;
    }

    /**
     * Records one completed job and notifies the callback when due.
     *
     * @param fileName short name of the completed file
     */
    void step(final String fileName) {
        if (processed >= total) {
            return;
        }
        processed++;
        if (processed % REPORT_EVERY == 0 || processed == total) {
            callbacks.onProgress(percent(), fileName);
        }
    }

    int percent() {
        return total == 0 ? 0 : (int) ((processed * 100L) / total);
    }

    int getProcessed() {
        return processed;
    }
}

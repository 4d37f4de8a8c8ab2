package eu.virtualparadox.docscan.scan;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one search. The orchestrator polls it once per completed job.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

package eu.virtualparadox.docscan.application.executor;

import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Factory for the fixed-size pools that execute scan jobs.
 * <p>Each search gets a fresh pool, so cancelling one search can shut its pool down
 * without waiting and without affecting later searches.</p>
 */
public class ScanWorkerPool {

    private final int workers;
    private final CustomizableThreadFactory threadFactory;

    public ScanWorkerPool(final int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }
        this.workers = workers;
        this.threadFactory = new CustomizableThreadFactory("scan-");
        this.threadFactory.setDaemon(true);
    }

    public ExecutorService newPool() {
        return Executors.newFixedThreadPool(workers, threadFactory);
    }

    public int getWorkers() {
        return workers;
    }
}

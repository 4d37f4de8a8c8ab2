package eu.virtualparadox.docscan.scan;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Independent unit of work for one file. A job receives everything it needs at construction
 * and shares no mutable state with other jobs.
 */
public interface ScanJob extends Callable<MatchResult> {

    Path path();

    @Override
    MatchResult call();
}

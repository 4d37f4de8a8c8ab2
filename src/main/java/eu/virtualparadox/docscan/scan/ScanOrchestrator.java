package eu.virtualparadox.docscan.scan;

import eu.virtualparadox.docscan.application.executor.ScanWorkerPool;
import eu.virtualparadox.docscan.ingest.extractor.TextExtractor;
import eu.virtualparadox.docscan.search.keyword.KeywordMatcher;
import eu.virtualparadox.docscan.search.keyword.KeywordQuery;
import eu.virtualparadox.docscan.search.similarity.TokenSimilarityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs archive-wide searches: one job per file, executed on a fixed-size worker pool.
 *
 * <h2>Execution</h2>
 * <ul>
 *   <li>All jobs are submitted to a fresh pool from {@link ScanWorkerPool}; the calling thread then
 *       drains completions in completion order.</li>
 *   <li>Per completion: the {@link CancellationToken} is polled, the job result is read (a failing job
 *       counts as a non-match), matches go to {@link ScanCallbacks#onMatch}, and progress is
 *       reported through {@link ScanProgressTracker}.</li>
 *   <li>On cancellation the pool is shut down without waiting; results still in flight are discarded.</li>
 *   <li>{@link ScanCallbacks#onDone} fires exactly once per started search.</li>
 * </ul>
 *
 * <h2>One search at a time</h2>
 * Starting a search while another is active does not run a second one: it cancels the active
 * search and returns {@link Optional#empty()}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanOrchestrator {

    private final CandidateFileCollector candidateFileCollector;
    private final TextExtractor textExtractor;
    private final KeywordMatcher keywordMatcher;
    private final TokenSimilarityScorer similarityScorer;
    private final ScanWorkerPool scanWorkerPool;

    private final AtomicReference<CancellationToken> activeSearch = new AtomicReference<>();

    /**
     * @param root archive root
     * @return readable candidate files under {@code root}
     */
    public List<Path> collectFiles(final Path root) {
        return candidateFileCollector.collect(root);
    }

    public Optional<ScanSummary> runKeywordSearch(final List<Path> files,
                                                  final String query,
                                                  final boolean regex,
                                                  final ScanCallbacks callbacks) {
        return runKeywordSearch(files, query, regex, callbacks, new CancellationToken());
    }

    /**
     * Tests every file against a literal or regex query.
     *
     * @param files     files to scan
     * @param query     query text; must not be blank
     * @param regex     whether {@code query} is a regular expression
     * @param callbacks receiver of matches, progress and completion
     * @param token     cancellation flag for this search
     * @return summary, or empty if the call only cancelled an already running search
     * @throws IllegalArgumentException if {@code query} is blank
     */
    public Optional<ScanSummary> runKeywordSearch(final List<Path> files,
                                                  final String query,
                                                  final boolean regex,
                                                  final ScanCallbacks callbacks,
                                                  final CancellationToken token) {
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(callbacks, "callbacks must not be null");
        Objects.requireNonNull(token, "token must not be null");
        if (StringUtils.isBlank(query)) {
            throw new IllegalArgumentException("query must not be blank");
        }

        if (!acquire(token)) {
            return Optional.empty();
        }
        try {
            final KeywordQuery prepared = keywordMatcher.prepare(query, regex);
            final List<ScanJob> jobs = files.stream()
                    .<ScanJob>map(file -> new KeywordScanJob(file, prepared, textExtractor, keywordMatcher))
                    .toList();
            log.info("Keyword search for '{}' (regex={}) over {} files", query, regex, jobs.size());
            return Optional.of(execute(EScanType.KEYWORD, jobs, callbacks, token));
        } finally {
            release(token);
        }
    }

    public Optional<ScanSummary> runSimilaritySearch(final List<Path> files,
                                                     final Path reference,
                                                     final ScanCallbacks callbacks) {
        return runSimilaritySearch(files, reference, callbacks, new CancellationToken());
    }

    /**
     * Scores every file except {@code reference} by token overlap with {@code reference}.
     *
     * @param files     files to scan; the reference itself is skipped
     * @param reference reference document
     * @param callbacks receiver of matches, progress and completion
     * @param token     cancellation flag for this search
     * @return summary, or empty if the call only cancelled an already running search
     */
    public Optional<ScanSummary> runSimilaritySearch(final List<Path> files,
                                                     final Path reference,
                                                     final ScanCallbacks callbacks,
                                                     final CancellationToken token) {
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(callbacks, "callbacks must not be null");
        Objects.requireNonNull(token, "token must not be null");

        if (!acquire(token)) {
            return Optional.empty();
        }
        try {
            final Set<String> referenceTokens = Set.copyOf(similarityScorer.tokenize(textExtractor.extractText(reference)));
            if (referenceTokens.isEmpty()) {
                log.warn("Reference {} has no comparable tokens, nothing to scan", reference);
                callbacks.onDone(0);
                return Optional.of(new ScanSummary(0, 0, 0, false));
            }

            final Path referenceKey = reference.toAbsolutePath().normalize();
            final List<ScanJob> jobs = files.stream()
                    .filter(file -> !file.toAbsolutePath().normalize().equals(referenceKey))
                    .<ScanJob>map(file -> new SimilarityScanJob(file, referenceTokens, textExtractor, similarityScorer))
                    .toList();
            log.info("Similarity search against {} ({} tokens) over {} files",
                    reference.getFileName(), referenceTokens.size(), jobs.size());
            return Optional.of(execute(EScanType.SIMILARITY, jobs, callbacks, token));
        } finally {
            release(token);
        }
    }

    /**
     * Requests cancellation of the running search, if any.
     */
    public void cancelActive() {
        final CancellationToken active = activeSearch.get();
        if (active != null) {
            active.cancel();
        }
    }

    public boolean isSearching() {
        return activeSearch.get() != null;
    }

    private ScanSummary execute(final EScanType type,
                                final List<ScanJob> jobs,
                                final ScanCallbacks callbacks,
                                final CancellationToken token) {
        final int total = jobs.size();
        final ScanProgressTracker tracker = new ScanProgressTracker(total, callbacks);
        int matches = 0;
        boolean cancelled = false;

        if (total == 0) {
            callbacks.onDone(0);
            return new ScanSummary(0, 0, 0, false);
        }

        final ExecutorService pool = scanWorkerPool.newPool();
        final CompletionService<MatchResult> completion = new ExecutorCompletionService<>(pool);
        final Map<Future<MatchResult>, Path> pending = new HashMap<>(total * 2);
        try {
            for (final ScanJob job : jobs) {
                if (token.isCancelled()) {
                    break;
                }
                pending.put(completion.submit(job), job.path());
            }

            final int submitted = pending.size();
            cancelled = token.isCancelled();
            for (int i = 0; i < submitted && !cancelled; i++) {
                final Future<MatchResult> future = completion.take();
                if (token.isCancelled()) {
                    cancelled = true;
                    break;
                }

                final Path path = pending.remove(future);
                final MatchResult result = resultOf(future, path, type);
                if (result.found()) {
                    matches++;
                    callbacks.onMatch(result);
                }
                tracker.step(fileNameOf(path));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
        } finally {
            if (cancelled) {
                pool.shutdownNow();
            } else {
                pool.shutdown();
            }
        }

        if (cancelled) {
            log.info("{} search cancelled after {}/{} files, {} matches",
                    type.getLabel(), tracker.getProcessed(), total, matches);
        } else {
            log.info("{} search completed: {} files, {} matches", type.getLabel(), total, matches);
        }
        callbacks.onDone(matches);
        return new ScanSummary(total, tracker.getProcessed(), matches, cancelled);
    }

    private MatchResult resultOf(final Future<MatchResult> future,
                                 final Path path,
                                 final EScanType type) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.debug("Scan job failed for {}", path, e.getCause());
            return MatchResult.notFound(path, type);
        }
    }

    /**
     * Registers {@code token} as the active search, or cancels the search that holds the slot.
     * Retries when the active search ends between the failed swap and the lookup.
     */
    private boolean acquire(final CancellationToken token) {
        while (true) {
            if (activeSearch.compareAndSet(null, token)) {
                return true;
            }
            final CancellationToken active = activeSearch.get();
            if (active != null) {
                log.info("A search is already running, cancelling it instead of starting another");
                active.cancel();
                return false;
            }
        }
    }

    private void release(final CancellationToken token) {
        activeSearch.compareAndSet(token, null);
    }

    private static String fileNameOf(final Path path) {
        final Path name = path == null ? null : path.getFileName();
        return name == null ? String.valueOf(path) : name.toString();
    }
}

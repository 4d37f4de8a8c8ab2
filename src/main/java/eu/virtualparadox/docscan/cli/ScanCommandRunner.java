package eu.virtualparadox.docscan.cli;

import eu.virtualparadox.docscan.compare.ChunkComparator;
import eu.virtualparadox.docscan.compare.ComparisonResult;
import eu.virtualparadox.docscan.report.CsvReportWriter;
import eu.virtualparadox.docscan.report.ReportHeader;
import eu.virtualparadox.docscan.scan.EScanType;
import eu.virtualparadox.docscan.scan.MatchResult;
import eu.virtualparadox.docscan.scan.ScanCallbacks;
import eu.virtualparadox.docscan.scan.ScanOrchestrator;
import eu.virtualparadox.docscan.scan.ScanSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Headless entry point. Does nothing unless {@code --root} is given.
 * <pre>
 *   --root=DIR --query=TEXT [--regex] [--report=FILE]
 *   --root=DIR --reference=FILE [--compare=FILE] [--report=FILE]
 * </pre>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScanCommandRunner implements ApplicationRunner {

    static final String OPT_ROOT = "root";
    static final String OPT_QUERY = "query";
    static final String OPT_REGEX = "regex";
    static final String OPT_REFERENCE = "reference";
    static final String OPT_COMPARE = "compare";
    static final String OPT_REPORT = "report";

    private final ScanOrchestrator scanOrchestrator;
    private final ChunkComparator chunkComparator;
    private final CsvReportWriter csvReportWriter;

    @Override
    public void run(final ApplicationArguments args) {
        final Optional<String> root = option(args, OPT_ROOT);
        if (root.isEmpty()) {
            log.debug("No --{} given, nothing to scan", OPT_ROOT);
            return;
        }

        final Path rootPath = Path.of(root.get());
        final Optional<String> query = option(args, OPT_QUERY);
        final Optional<String> reference = option(args, OPT_REFERENCE);
        if (query.isEmpty() && reference.isEmpty()) {
            log.warn("Either --{} or --{} is required", OPT_QUERY, OPT_REFERENCE);
            return;
        }

        final List<Path> files = scanOrchestrator.collectFiles(rootPath);
        final LoggingCallbacks callbacks = new LoggingCallbacks();

        final ReportHeader header;
        if (query.isPresent()) {
            final boolean regex = args.containsOption(OPT_REGEX);
            scanOrchestrator.runKeywordSearch(files, query.get(), regex, callbacks)
                    .ifPresent(this::logSummary);
            header = new ReportHeader(LocalDateTime.now(), rootPath, EScanType.KEYWORD, query.get());
        } else {
            final Path referencePath = Path.of(reference.get());
            scanOrchestrator.runSimilaritySearch(files, referencePath, callbacks)
                    .ifPresent(this::logSummary);
            callbacks.matches.sort(Comparator.comparingDouble(MatchResult::score).reversed());
            header = new ReportHeader(LocalDateTime.now(), rootPath, EScanType.SIMILARITY, referencePath.toString());

            option(args, OPT_COMPARE).ifPresent(target -> compare(referencePath, Path.of(target)));
        }

        option(args, OPT_REPORT).ifPresent(report -> export(Path.of(report), header, callbacks.matches));
    }

    private void compare(final Path reference, final Path target) {
        final List<ComparisonResult> results = chunkComparator.compare(reference, target);
        for (final ComparisonResult r : results) {
            log.info("p.{} -> p.{} [{}%] {}", r.referencePage(), r.targetPage(), r.score(), r.preview());
        }
    }

    private void export(final Path target, final ReportHeader header, final List<MatchResult> matches) {
        try {
            csvReportWriter.write(target, header, matches);
        } catch (IOException e) {
            log.error("Unable to write report {}", target, e);
        }
    }

    private void logSummary(final ScanSummary summary) {
        log.info("Scanned {}/{} files, {} matches{}", summary.processed(), summary.total(), summary.matches(),
                summary.cancelled() ? " (cancelled)" : "");
    }

    private static Optional<String> option(final ApplicationArguments args, final String name) {
        final List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || StringUtils.isBlank(values.get(0))) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    private static final class LoggingCallbacks implements ScanCallbacks {

        private final List<MatchResult> matches = new ArrayList<>();

        @Override
        public void onMatch(final MatchResult result) {
            matches.add(result);
            log.info("[{}] {} {}", result.location(), result.path(), result.context());
        }

        @Override
        public void onProgress(final int percent, final String fileName) {
            log.debug("{}% scanning {}", percent, fileName);
        }

        @Override
        public void onDone(final int totalMatches) {
            log.info("Search finished, {} matches", totalMatches);
        }
    }
}

package eu.virtualparadox.docscan.report;

import eu.virtualparadox.docscan.scan.EScanType;
import eu.virtualparadox.docscan.scan.MatchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes search results as the delimited report table:
 * <pre>
 *   Report:, {timestamp}, Root:, {root}
 *   Type:, {Keyword|Similarity}, Query:, {query}, ""
 *   File, Dir, Loc/Score, Context, Path
 *   {one row per match}
 * </pre>
 * Files are UTF-8 with a byte order mark so spreadsheet tools detect the encoding.
 */
@Component
@Slf4j
public class CsvReportWriter {

    static final List<String> COLUMNS = List.of("File", "Dir", "Loc/Score", "Context", "Path");

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
    private static final char BOM = '\uFEFF';

    public void write(final Path target, final ReportHeader header, final List<MatchResult> matches) throws IOException {
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            out.write(BOM);
            write(out, header, matches);
        }
        log.info("Exported {} rows to {}", matches.size(), target);
    }

    public void write(final Writer out, final ReportHeader header, final List<MatchResult> matches) throws IOException {
        final CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT);
        printer.printRecord("Report:", TIMESTAMP.format(header.createdAt()), "Root:", header.root());
        printer.printRecord("Type:", header.type().getLabel(), "Query:", header.query(), "");
        printer.printRecord(COLUMNS);
        for (final MatchResult match : matches) {
            if (match.found()) {
                printer.printRecord(toRow(header.root(), match));
            }
        }
        printer.flush();
    }

    static List<String> toRow(final Path root, final MatchResult match) {
        final Path path = match.path();
        final String fileName = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        final String location = match.type() == EScanType.SIMILARITY ? match.location() + "%" : match.location();
        return List.of(fileName, relativeDirectory(root, path), location, match.context(), path.toString());
    }

    static String relativeDirectory(final Path root, final Path path) {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent == null) {
            return "";
        }
        try {
            final String relative = root.toAbsolutePath().normalize().relativize(parent.normalize()).toString();
            return relative.isEmpty() ? "." : relative;
        } catch (IllegalArgumentException e) {
            return parent.toString();
        }
    }
}

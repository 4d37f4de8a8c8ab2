package eu.virtualparadox.docscan.report;

import eu.virtualparadox.docscan.scan.EScanType;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * @param createdAt when the report was produced
 * @param root      archive root the search ran on
 * @param type      search type
 * @param query     keyword query, or the reference file path of a similarity search
 */
public record ReportHeader(LocalDateTime createdAt, Path root, EScanType type, String query) {

}

package eu.virtualparadox.docscan.ingest.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of extracting a single file.
 * <p>Extraction never throws: a corrupt or unreadable file produces an empty result
 * carrying the reason, which callers treat as "no text".</p>
 *
 * @param pages         ordered pages; empty on failure
 * @param failureReason why nothing was extracted, or {@code null} on success
 */
public record ExtractionResult(List<Page> pages, String failureReason) {

    public ExtractionResult {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public static ExtractionResult of(final List<Page> pages) {
        return new ExtractionResult(pages, null);
    }

    public static ExtractionResult failed(final String reason) {
        return new ExtractionResult(List.of(), reason);
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public boolean isEmpty() {
        return pages.isEmpty() || pages.stream().allMatch(p -> p.text().isEmpty());
    }

    /**
     * @return all page texts joined by a newline, in page order
     */
    public String fullText() {
        if (pages.size() == 1) {
            return pages.get(0).text();
        }
        return pages.stream().map(Page::text).collect(Collectors.joining("\n"));
    }
}

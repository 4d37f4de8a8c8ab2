package eu.virtualparadox.docscan.ingest.model;

/**
 * Immutable paragraph-scale piece of a document produced by the paragraph chunker.
 *
 * @param sequence 1-based id, increasing across the whole document (not per page)
 * @param page     label of the page the chunk text started on
 * @param text     trimmed chunk text
 */
public record Chunk(int sequence, String page, String text) {

    public int length() {
        return text.length();
    }
}

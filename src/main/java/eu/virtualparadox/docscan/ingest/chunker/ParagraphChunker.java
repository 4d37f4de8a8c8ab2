package eu.virtualparadox.docscan.ingest.chunker;

import eu.virtualparadox.docscan.ingest.model.Chunk;
import eu.virtualparadox.docscan.ingest.model.Page;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits page text into paragraph-scale {@link Chunk}s.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Each page is trimmed and split on runs of two or more consecutive newlines.</li>
 *   <li>Every piece is trimmed; pieces of {@value #MIN_CHUNK_LENGTH} characters or fewer are dropped.</li>
 *   <li>Chunk sequence numbers start at 1 and run across the whole document, not per page.</li>
 *   <li>A chunk is labelled with the page its text started on. Chunking is per page, so a
 *       paragraph that continues on the next page becomes two chunks.</li>
 * </ul>
 *
 * <p>Stateless and thread-safe; output is deterministic for a given page list.</p>
 */
@Component
public class ParagraphChunker {

    /**
     * Trimmed chunks must be strictly longer than this to be kept.
     */
    public static final int MIN_CHUNK_LENGTH = 10;

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n{2,}");

    /**
     * @param pages ordered document pages
     * @return ordered chunks of all pages
     */
    public List<Chunk> chunk(final List<Page> pages) {
        final List<Chunk> result = new ArrayList<>();
        int sequence = 1;

        for (final Page page : pages) {
            final String text = page.text() == null ? "" : page.text().strip();
            if (text.isEmpty()) {
                continue;
            }
            for (final String piece : PARAGRAPH_BREAK.split(text)) {
                final String cleaned = piece.strip();
                if (cleaned.length() > MIN_CHUNK_LENGTH) {
                    result.add(new Chunk(sequence++, page.label(), cleaned));
                }
            }
        }
        return result;
    }
}

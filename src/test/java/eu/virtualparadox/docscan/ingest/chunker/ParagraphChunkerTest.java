package eu.virtualparadox.docscan.ingest.chunker;

import eu.virtualparadox.docscan.ingest.model.Chunk;
import eu.virtualparadox.docscan.ingest.model.Page;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParagraphChunkerTest {

    private final ParagraphChunker chunker = new ParagraphChunker();

    @Test
    @DisplayName("Sequence numbers run across pages and keep the page label")
    void sequenceAcrossPages() {
        final List<Page> pages = List.of(
                new Page("1", "First paragraph text\n\nSecond paragraph text"),
                new Page("2", "Third paragraph text"));

        final List<Chunk> chunks = chunker.chunk(pages);

        assertEquals(List.of(
                new Chunk(1, "1", "First paragraph text"),
                new Chunk(2, "1", "Second paragraph text"),
                new Chunk(3, "2", "Third paragraph text")), chunks);
    }

    @Test
    @DisplayName("Pieces of ten characters or fewer are dropped")
    void shortPiecesDropped() {
        final List<Chunk> chunks = chunker.chunk(List.of(
                new Page("1", "0123456789\n\n0123456789A\n\n\n\n   tiny   ")));

        assertEquals(1, chunks.size());
        assertEquals("0123456789A", chunks.get(0).text());
        assertEquals(1, chunks.get(0).sequence());
    }

    @Test
    @DisplayName("Single newlines stay inside a chunk")
    void singleNewlineKept() {
        final List<Chunk> chunks = chunker.chunk(List.of(new Page("1", "  line one\nline two  \n\n")));

        assertEquals(List.of(new Chunk(1, "1", "line one\nline two")), chunks);
    }

    @Test
    @DisplayName("Empty pages produce no chunks")
    void emptyPages() {
        assertTrue(chunker.chunk(List.of(new Page("1", ""), new Page("2", " \n\n "))).isEmpty());
        assertTrue(chunker.chunk(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Chunking is deterministic")
    void deterministic() {
        final List<Page> pages = List.of(new Page("1", "Alpha paragraph one\n\nBeta paragraph two"));

        assertEquals(chunker.chunk(pages), chunker.chunk(pages));
    }
}

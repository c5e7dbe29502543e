package it.aw.annotator.service;

import it.aw.annotator.model.ChunkingParams;
import it.aw.annotator.model.TextChunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextChunkerTest {

    @Test
    void shortTextProducesSingleChunk() {
        String text = "x".repeat(400);

        List<TextChunk> chunks = TextChunker.chunk(text, new ChunkingParams(500, 50));

        assertEquals(1, chunks.size());
        assertEquals(0, chunks.get(0).startPosition());
        assertEquals(400, chunks.get(0).endPosition());
        assertEquals(text, chunks.get(0).text());
    }

    @Test
    void textWithoutSentenceEndsAdvancesBySizeMinusOverlap() {
        String text = "x".repeat(1200);

        List<TextChunk> chunks = TextChunker.chunk(text, new ChunkingParams(500, 50));

        assertEquals(3, chunks.size());
        assertSpan(chunks.get(0), 0, 500);
        assertSpan(chunks.get(1), 450, 950);
        assertSpan(chunks.get(2), 900, 1200);
    }

    @Test
    void chunkEndSnapsToNearbySentenceBoundary() {
        String text = "A".repeat(478) + ". " + "B".repeat(600);

        List<TextChunk> chunks = TextChunker.chunk(text, new ChunkingParams(500, 50));

        assertSpan(chunks.get(0), 0, 480);
        assertTrue(chunks.get(0).text().endsWith(". "));
        assertEquals(430, chunks.get(1).startPosition());
    }

    @Test
    void boundaryOutsideToleranceIsIgnored() {
        String text = "A".repeat(100) + ". " + "B".repeat(1000);

        List<TextChunk> chunks = TextChunker.chunk(text, new ChunkingParams(500, 50));

        assertSpan(chunks.get(0), 0, 500);
    }

    @Test
    void closestBoundaryWins() {
        String window = "x".repeat(460) + ". " + "y".repeat(35) + "! " + "z".repeat(100);

        // ". " finisce a 462, "! " a 499
        assertEquals(499, TextChunker.findSentenceEnd(window, 500));
    }

    @Test
    void chunksCoverTextAndMatchTheirOffsets() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 120; i++) {
            sb.append("Sentence number ").append(i).append(" talks about remote work and output. ");
        }
        String text = sb.toString().trim();

        List<TextChunk> chunks = TextChunker.chunk(text, ChunkingParams.defaults());

        assertFalse(chunks.isEmpty());
        assertEquals(0, chunks.get(0).startPosition());
        assertEquals(text.length(), chunks.get(chunks.size() - 1).endPosition());
        for (int i = 0; i < chunks.size(); i++) {
            TextChunk c = chunks.get(i);
            assertEquals(text.substring(c.startPosition(), c.endPosition()), c.text());
            assertTrue(c.startPosition() < c.endPosition());
            if (i > 0) {
                TextChunk prev = chunks.get(i - 1);
                assertTrue(c.startPosition() > prev.startPosition(), "gli start devono crescere");
                assertTrue(c.startPosition() <= prev.endPosition(), "nessun buco tra chunk consecutivi");
            }
        }
    }

    @Test
    void emptyTextProducesNoChunks() {
        assertTrue(TextChunker.chunk("").isEmpty());
        assertTrue(TextChunker.chunk(null).isEmpty());
    }

    @Test
    void overlapNotSmallerThanSizeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkingParams(100, 100));
        assertThrows(IllegalArgumentException.class, () -> new ChunkingParams(100, -1));
        assertThrows(IllegalArgumentException.class, () -> new ChunkingParams(10, 0));
    }

    private static void assertSpan(TextChunk chunk, int start, int end) {
        assertEquals(start, chunk.startPosition(), "start");
        assertEquals(end, chunk.endPosition(), "end");
    }
}

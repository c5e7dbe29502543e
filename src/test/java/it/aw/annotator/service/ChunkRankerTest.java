package it.aw.annotator.service;

import it.aw.annotator.exception.EmbeddingException;
import it.aw.annotator.model.Chunk;
import it.aw.annotator.model.RankedCandidate;
import it.aw.annotator.model.ThoroughnessLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkRankerTest {

    private static final float[] QUERY = {1f, 0f};

    @Test
    void cosineOfVectorWithItselfIsOne() {
        float[] v = {0.3f, -1.2f, 4f};
        assertEquals(1.0, ChunkRanker.cosine(v, v), 1e-6);
    }

    @Test
    void mismatchedDimensionsAreAnEmbeddingFailure() {
        assertThrows(EmbeddingException.class, () -> ChunkRanker.cosine(new float[]{1f, 0f, 0f}, QUERY));
    }

    @Test
    void degenerateVectorsGiveZero() {
        assertEquals(0.0, ChunkRanker.cosine(new float[]{0f, 0f}, QUERY));
        assertEquals(0.0, ChunkRanker.cosine(null, QUERY));
        assertEquals(0.0, ChunkRanker.cosine(new float[0], QUERY));
    }

    @Test
    void rankSortsBySimilarityDescending() {
        List<Chunk> chunks = List.of(chunk("low", 0.2), chunk("high", 0.9), chunk("mid", 0.5));

        List<RankedCandidate> ranked = ChunkRanker.rank(chunks, QUERY);

        assertEquals(List.of("high", "mid", "low"), ids(ranked));
        assertEquals(0.9, ranked.get(0).similarity(), 1e-6);
    }

    @Test
    void standardLevelDropsChunksBelowThreshold() {
        List<Chunk> chunks = List.of(chunk("a", 0.9), chunk("b", 0.5), chunk("c", 0.2));

        List<RankedCandidate> selected = ChunkRanker.rank(chunks, QUERY, ThoroughnessLevel.STANDARD);

        assertEquals(List.of("a", "b"), ids(selected));
    }

    @Test
    void exhaustiveLevelUsesLowerThreshold() {
        List<Chunk> chunks = List.of(chunk("a", 0.9), chunk("b", 0.5), chunk("c", 0.2), chunk("d", 0.05));

        List<RankedCandidate> standard = ChunkRanker.rank(chunks, QUERY, ThoroughnessLevel.STANDARD);
        List<RankedCandidate> exhaustive = ChunkRanker.rank(chunks, QUERY, ThoroughnessLevel.EXHAUSTIVE);

        assertEquals(List.of("a", "b", "c"), ids(exhaustive));
        assertTrue(exhaustive.size() >= standard.size());
    }

    @Test
    void quickLevelCapsTheSelection() {
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            chunks.add(chunk("c" + i, 0.8));
        }

        assertEquals(10, ChunkRanker.rank(chunks, QUERY, ThoroughnessLevel.QUICK).size());
        assertEquals(15, ChunkRanker.rank(chunks, QUERY, ThoroughnessLevel.STANDARD).size());
    }

    @Test
    void tiesKeepInputOrder() {
        List<Chunk> chunks = List.of(chunk("first", 0.7), chunk("second", 0.7), chunk("third", 0.7));

        assertEquals(List.of("first", "second", "third"), ids(ChunkRanker.rank(chunks, QUERY)));
    }

    @Test
    void chunksWithoutEmbeddingAreSkipped() {
        Chunk missing = new Chunk("none", "doc", 1, "testo", 0, 5, null);

        List<RankedCandidate> ranked = ChunkRanker.rank(List.of(chunk("a", 0.9), missing), QUERY);

        assertEquals(List.of("a"), ids(ranked));
    }

    @Test
    void topIgnoresThreshold() {
        List<Chunk> chunks = List.of(chunk("a", 0.05), chunk("b", 0.02));

        assertEquals(List.of("a", "b"), ids(ChunkRanker.top(chunks, QUERY, 5)));
        assertEquals(List.of("a"), ids(ChunkRanker.top(chunks, QUERY, 1)));
    }

    @Test
    void unknownLevelFallsBackToStandard() {
        assertEquals(ThoroughnessLevel.STANDARD, ThoroughnessLevel.parse("ultra"));
        assertEquals(ThoroughnessLevel.STANDARD, ThoroughnessLevel.parse(null));
        assertEquals(ThoroughnessLevel.EXHAUSTIVE, ThoroughnessLevel.parse("Exhaustive"));
        assertFalse(ThoroughnessLevel.isKnown("ultra"));
    }

    /** Chunk il cui embedding ha similarità {@code similarity} con {@link #QUERY}. */
    static Chunk chunk(String id, double similarity) {
        float[] vector = {(float) similarity, (float) Math.sqrt(1 - similarity * similarity)};
        return new Chunk(id, "doc", 0, "testo " + id, 0, 10, vector);
    }

    private static List<String> ids(List<RankedCandidate> ranked) {
        return ranked.stream().map(c -> c.chunk().id()).toList();
    }
}

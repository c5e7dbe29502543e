package it.aw.annotator.service;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import it.aw.annotator.exception.EmbeddingException;
import it.aw.annotator.model.Chunk;
import it.aw.annotator.model.RankedCandidate;
import it.aw.annotator.model.ThoroughnessLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordina i chunk per similarità coseno rispetto a un vettore di query e
 * seleziona i candidati secondo il {@link ThoroughnessLevel}.
 * <p>
 * L'ordinamento è stabile: a parità di similarità resta l'ordine di input,
 * quindi chiamate ripetute con gli stessi dati danno lo stesso risultato.
 * I chunk senza embedding vengono ignorati; il calcolo lazy degli embedding
 * spetta a {@link ChunkEmbeddingService}.
 */
public final class ChunkRanker {

    private ChunkRanker() {}

    /**
     * Similarità coseno; 0 se uno dei due vettori è nullo, vuoto o a norma zero.
     *
     * @throws EmbeddingException se le dimensioni non coincidono
     */
    public static double cosine(float[] a, float[] b) {
        if (isDegenerate(a) || isDegenerate(b)) {
            return 0.0;
        }
        if (a.length != b.length) {
            throw new EmbeddingException("Dimensioni degli embedding incompatibili: "
                    + a.length + " e " + b.length);
        }
        return CosineSimilarity.between(Embedding.from(a), Embedding.from(b));
    }

    /** Tutti i chunk con embedding, in ordine di similarità decrescente. */
    public static List<RankedCandidate> rank(List<Chunk> chunks, float[] queryVector) {
        List<RankedCandidate> ranked = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            if (!chunk.hasEmbedding()) continue;
            ranked.add(new RankedCandidate(chunk, cosine(chunk.embedding(), queryVector)));
        }
        ranked.sort(Comparator.comparingDouble(RankedCandidate::similarity).reversed());
        return ranked;
    }

    /** Ordina e applica la politica del livello. */
    public static List<RankedCandidate> rank(List<Chunk> chunks, float[] queryVector, ThoroughnessLevel level) {
        return select(rank(chunks, queryVector), level);
    }

    /**
     * Tiene i candidati con similarità {@code >= minSimilarity} e tronca a {@code maxChunks}.
     * L'input deve essere già ordinato.
     */
    public static List<RankedCandidate> select(List<RankedCandidate> ranked, ThoroughnessLevel level) {
        return ranked.stream()
                .filter(c -> c.similarity() >= level.minSimilarity())
                .limit(level.maxChunks())
                .toList();
    }

    /** I primi {@code n} candidati senza soglia di similarità. */
    public static List<RankedCandidate> top(List<Chunk> chunks, float[] queryVector, int n) {
        return rank(chunks, queryVector).stream().limit(n).toList();
    }

    private static boolean isDegenerate(float[] vector) {
        if (vector == null || vector.length == 0) return true;
        for (float v : vector) {
            if (v != 0f) return false;
        }
        return true;
    }
}

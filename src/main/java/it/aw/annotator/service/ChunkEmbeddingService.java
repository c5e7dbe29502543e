package it.aw.annotator.service;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import it.aw.annotator.exception.EmbeddingException;
import it.aw.annotator.model.Chunk;
import it.aw.annotator.registry.DocumentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Calcolo degli embedding per query e chunk.
 * <p>
 * Gli embedding dei chunk sono calcolati al primo utilizzo e salvati subito:
 * un chunk che ha già il vettore non viene mai ricalcolato. Gli errori del
 * modello si propagano al chiamante, nessun vettore viene inventato.
 */
@Service
public class ChunkEmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(ChunkEmbeddingService.class);

    private final EmbeddingModel embeddingModel;
    private final DocumentRegistry registry;

    public ChunkEmbeddingService(EmbeddingModel embeddingModel, DocumentRegistry registry) {
        this.embeddingModel = embeddingModel;
        this.registry = registry;
    }

    /** Vettore di query per un testo transitorio (intent, ricerca, tesi). Non persistito. */
    public float[] embed(String text) {
        return embeddingModel.embed(text).content().vector();
    }

    /**
     * Restituisce i chunk con embedding, calcolando e salvando solo quelli mancanti.
     * L'ordine dell'input è preservato.
     */
    public List<Chunk> ensureEmbeddings(List<Chunk> chunks) {
        List<Chunk> missing = chunks.stream().filter(c -> !c.hasEmbedding()).toList();
        if (missing.isEmpty()) {
            return chunks;
        }

        List<TextSegment> segments = missing.stream().map(c -> TextSegment.from(c.text())).toList();
        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
        if (embeddings.size() != missing.size()) {
            throw new EmbeddingException("Il modello ha restituito " + embeddings.size()
                    + " embedding per " + missing.size() + " chunk");
        }

        List<Chunk> result = new ArrayList<>(chunks.size());
        int next = 0;
        for (Chunk chunk : chunks) {
            if (chunk.hasEmbedding()) {
                result.add(chunk);
                continue;
            }
            float[] vector = embeddings.get(next++).vector();
            registry.updateChunkEmbedding(chunk.id(), vector);
            result.add(chunk.withEmbedding(vector));
        }
        log.debug("Embedding calcolati per {} chunk su {}", missing.size(), chunks.size());
        return result;
    }
}

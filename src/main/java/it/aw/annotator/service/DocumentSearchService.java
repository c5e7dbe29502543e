package it.aw.annotator.service;

import it.aw.annotator.exception.NotFoundException;
import it.aw.annotator.llm.QuoteExtractor;
import it.aw.annotator.model.Chunk;
import it.aw.annotator.model.DocumentRecord;
import it.aw.annotator.model.Project;
import it.aw.annotator.model.ProjectDocument;
import it.aw.annotator.model.RankedCandidate;
import it.aw.annotator.model.SearchResult;
import it.aw.annotator.registry.DocumentRegistry;
import it.aw.annotator.registry.ProjectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ricerca semantica su un singolo documento.
 * <p>
 * I chunk vengono ordinati per similarità con la query (embedding calcolati
 * al bisogno) e i primi {@value #TOP_CHUNKS} passano all'estrattore di citazioni.
 * Qui non si applica nessuna soglia: la rilevanza dei risultati è giudicata
 * dall'estrattore.
 */
@Service
public class DocumentSearchService {

    private static final Logger log = LoggerFactory.getLogger(DocumentSearchService.class);

    static final int TOP_CHUNKS = 5;

    private final DocumentRegistry documentRegistry;
    private final ProjectRegistry projectRegistry;
    private final ChunkEmbeddingService embeddingService;
    private final QuoteExtractor quoteExtractor;

    public DocumentSearchService(DocumentRegistry documentRegistry,
                                 ProjectRegistry projectRegistry,
                                 ChunkEmbeddingService embeddingService,
                                 QuoteExtractor quoteExtractor) {
        this.documentRegistry = documentRegistry;
        this.projectRegistry = projectRegistry;
        this.embeddingService = embeddingService;
        this.quoteExtractor = quoteExtractor;
    }

    /** Ricerca su un documento; il contesto è l'intent dell'utente, se impostato. */
    public List<SearchResult> searchDocument(String documentId, String query) {
        requireQuery(query);
        DocumentRecord doc = documentRegistry.findById(documentId)
                .orElseThrow(() -> NotFoundException.document(documentId));
        return search(doc, query, doc.userIntent());
    }

    /**
     * Ricerca su un documento collegato a un progetto; il contesto è la tesi
     * del progetto, altrimenti l'intent del documento.
     */
    public List<SearchResult> searchProjectDocument(String projectDocumentId, String query) {
        requireQuery(query);
        ProjectDocument link = projectRegistry.findLink(projectDocumentId)
                .orElseThrow(() -> NotFoundException.projectDocument(projectDocumentId));
        DocumentRecord doc = documentRegistry.findById(link.documentId())
                .orElseThrow(() -> NotFoundException.document(link.documentId()));
        String thesis = projectRegistry.findProject(link.projectId())
                .map(Project::thesis)
                .orElse(null);
        return search(doc, query, thesis != null && !thesis.isBlank() ? thesis : doc.userIntent());
    }

    private List<SearchResult> search(DocumentRecord doc, String query, String context) {
        List<Chunk> chunks = documentRegistry.findChunks(doc.id());
        if (chunks.isEmpty()) {
            log.debug("Nessun chunk per {}, ricerca vuota", doc.id());
            return List.of();
        }

        float[] queryVector = embeddingService.embed(query);
        List<Chunk> top = ChunkRanker.top(embeddingService.ensureEmbeddings(chunks), queryVector, TOP_CHUNKS)
                .stream()
                .map(RankedCandidate::chunk)
                .toList();

        List<SearchResult> results = quoteExtractor.extractQuotes(query, context != null ? context : "", top);
        log.info("Ricerca '{}' su {}: {} citazioni da {} chunk", query, doc.filename(), results.size(), top.size());
        return results;
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("La query è obbligatoria");
        }
    }
}

package it.aw.annotator.service;

import it.aw.annotator.exception.DocumentNotAnalyzableException;
import it.aw.annotator.exception.NotFoundException;
import it.aw.annotator.llm.AnnotationPipeline;
import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.AnnotationSpan;
import it.aw.annotator.model.Chunk;
import it.aw.annotator.model.DocumentRecord;
import it.aw.annotator.model.RankedCandidate;
import it.aw.annotator.model.ThoroughnessLevel;
import it.aw.annotator.registry.AnnotationRegistry;
import it.aw.annotator.registry.DocumentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Imposta l'intent di ricerca di un documento e rigenera le annotazioni automatiche.
 * <p>
 * Flusso:
 * <ol>
 *   <li>salva l'intent sul documento</li>
 *   <li>embedding dell'intent e, se mancanti, dei chunk</li>
 *   <li>ranking dei chunk e selezione secondo il livello di approfondimento</li>
 *   <li>pipeline di annotazione sui chunk selezionati</li>
 *   <li>sostituzione delle annotazioni automatiche precedenti; quelle dell'utente restano</li>
 * </ol>
 * Se la pipeline fallisce le annotazioni esistenti non vengono toccate.
 */
@Service
public class IntentAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(IntentAnalysisService.class);

    private final DocumentRegistry documentRegistry;
    private final AnnotationRegistry annotationRegistry;
    private final ChunkEmbeddingService embeddingService;
    private final AnnotationPipeline pipeline;

    public IntentAnalysisService(DocumentRegistry documentRegistry,
                                 AnnotationRegistry annotationRegistry,
                                 ChunkEmbeddingService embeddingService,
                                 AnnotationPipeline pipeline) {
        this.documentRegistry = documentRegistry;
        this.annotationRegistry = annotationRegistry;
        this.embeddingService = embeddingService;
        this.pipeline = pipeline;
    }

    /**
     * @param thoroughness nome del livello; null o sconosciuto equivale a "standard"
     * @return le annotazioni del documento dopo l'analisi, oppure lista vuota
     *         se nessun chunk supera la soglia di similarità
     */
    public List<Annotation> setIntent(String documentId, String intent, String thoroughness) {
        if (intent == null || intent.isBlank()) {
            throw new IllegalArgumentException("L'intent è obbligatorio");
        }
        ThoroughnessLevel level = ThoroughnessLevel.parse(thoroughness);
        if (thoroughness != null && !ThoroughnessLevel.isKnown(thoroughness)) {
            log.warn("Livello di approfondimento sconosciuto '{}', uso {}", thoroughness, level.wireName());
        }

        DocumentRecord doc = documentRegistry.findById(documentId)
                .orElseThrow(() -> NotFoundException.document(documentId));
        documentRegistry.updateIntent(documentId, intent);

        List<Chunk> chunks = documentRegistry.findChunks(documentId);
        if (chunks.isEmpty()) {
            throw new DocumentNotAnalyzableException("Il documento non ha chunk di testo da analizzare");
        }

        float[] intentVector = embeddingService.embed(intent);
        List<Chunk> embedded = embeddingService.ensureEmbeddings(chunks);
        List<RankedCandidate> selected = ChunkRanker.rank(embedded, intentVector, level);

        log.info("Intent su {}: {} chunk selezionati su {} (livello {})",
                doc.filename(), selected.size(), chunks.size(), level.wireName());
        if (selected.isEmpty()) {
            return List.of();
        }

        List<Annotation> priorUserAnnotations = annotationRegistry.findByDocument(documentId).stream()
                .filter(a -> !a.aiGenerated())
                .toList();
        List<AnnotationSpan> spans = pipeline.run(
                selected.stream().map(RankedCandidate::chunk).toList(),
                intent, documentId, doc.fullText(), priorUserAnnotations);

        int removed = annotationRegistry.deleteAiGenerated(documentId);
        LocalDateTime now = LocalDateTime.now();
        annotationRegistry.saveAll(spans.stream()
                .map(span -> new Annotation(UUID.randomUUID().toString(), documentId,
                        span.absoluteStart(), span.absoluteEnd(), span.highlightText(),
                        span.category(), span.note(), null, true, span.confidence(), now))
                .toList());

        log.debug("Annotazioni automatiche sostituite: {} rimosse, {} nuove", removed, spans.size());
        return annotationRegistry.findByDocument(documentId);
    }
}

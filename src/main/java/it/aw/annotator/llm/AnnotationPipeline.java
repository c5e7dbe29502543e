package it.aw.annotator.llm;

import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.AnnotationSpan;
import it.aw.annotator.model.Chunk;

import java.util.List;

/**
 * Trasforma i chunk selezionati per un intent in span di annotazione categorizzati.
 */
public interface AnnotationPipeline {

    /**
     * @param topChunks            chunk selezionati dal ranker, in ordine di rilevanza
     * @param intent               obiettivo di ricerca dell'utente
     * @param documentId           documento di appartenenza
     * @param fullText             testo completo, spazio di coordinate degli span
     * @param priorUserAnnotations annotazioni dell'utente da non duplicare
     */
    List<AnnotationSpan> run(List<Chunk> topChunks, String intent, String documentId,
                             String fullText, List<Annotation> priorUserAnnotations);
}

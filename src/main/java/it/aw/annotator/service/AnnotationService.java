package it.aw.annotator.service;

import it.aw.annotator.exception.NotFoundException;
import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.AnnotationCategory;
import it.aw.annotator.model.DocumentRecord;
import it.aw.annotator.registry.AnnotationRegistry;
import it.aw.annotator.registry.DocumentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Annotazioni manuali: creazione, modifica di nota e categoria, eliminazione.
 */
@Service
public class AnnotationService {

    private static final Logger log = LoggerFactory.getLogger(AnnotationService.class);

    private final AnnotationRegistry annotationRegistry;
    private final DocumentRegistry documentRegistry;

    public AnnotationService(AnnotationRegistry annotationRegistry, DocumentRegistry documentRegistry) {
        this.annotationRegistry = annotationRegistry;
        this.documentRegistry = documentRegistry;
    }

    /** Annotazioni del documento ordinate per posizione; vuota per id sconosciuti. */
    public List<Annotation> list(String documentId) {
        return annotationRegistry.findByDocument(documentId);
    }

    /**
     * Crea un'annotazione dell'utente. Lo span deve stare dentro il fullText;
     * se highlightedText è assente viene preso dal testo del documento.
     */
    public Annotation create(String documentId, int start, int end, String highlightedText,
                             AnnotationCategory category, String note, String searchableContent) {
        DocumentRecord doc = documentRegistry.findById(documentId)
                .orElseThrow(() -> NotFoundException.document(documentId));
        int length = doc.fullText().length();
        if (start < 0 || start >= end || end > length) {
            throw new IllegalArgumentException(
                    "Span non valido [" + start + ", " + end + ") per un testo di " + length + " caratteri");
        }
        String text = highlightedText != null && !highlightedText.isBlank()
                ? highlightedText
                : doc.fullText().substring(start, end);

        Annotation annotation = new Annotation(UUID.randomUUID().toString(), documentId, start, end, text,
                category != null ? category : AnnotationCategory.USER_ADDED,
                note != null ? note : "", searchableContent, false, null, LocalDateTime.now());
        annotationRegistry.save(annotation);
        log.info("Annotazione manuale creata: {} su {} [{}, {})", annotation.id(), doc.filename(), start, end);
        return annotation;
    }

    /** Aggiorna nota e categoria; un campo null mantiene il valore corrente. */
    public Annotation update(String annotationId, String note, AnnotationCategory category) {
        Annotation current = annotationRegistry.findById(annotationId)
                .orElseThrow(() -> NotFoundException.annotation(annotationId));
        return annotationRegistry.update(annotationId,
                        note != null ? note : current.note(),
                        category != null ? category : current.category())
                .orElseThrow(() -> NotFoundException.annotation(annotationId));
    }

    public void delete(String annotationId) {
        if (!annotationRegistry.delete(annotationId)) {
            throw NotFoundException.annotation(annotationId);
        }
        log.info("Annotazione eliminata: {}", annotationId);
    }
}

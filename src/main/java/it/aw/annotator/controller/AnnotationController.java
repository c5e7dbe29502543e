package it.aw.annotator.controller;

import it.aw.annotator.controller.dto.AnnotationRequest;
import it.aw.annotator.controller.dto.AnnotationUpdateRequest;
import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.AnnotationCategory;
import it.aw.annotator.service.AnnotationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Annotazioni di un documento.
 *
 * Endpoint disponibili:
 *   GET    /api/documents/{id}/annotations  annotazioni ordinate per posizione
 *   POST   /api/documents/{id}/annotate     nuova annotazione manuale
 *   PUT    /api/annotations/{id}            modifica nota e categoria
 *   DELETE /api/annotations/{id}            elimina un'annotazione
 */
@RestController
@RequestMapping("/api")
public class AnnotationController {

    private final AnnotationService annotationService;

    public AnnotationController(AnnotationService annotationService) {
        this.annotationService = annotationService;
    }

    // -------------------------------------------------------------------------
    // GET /api/documents/{id}/annotations
    // -------------------------------------------------------------------------

    @GetMapping("/documents/{id}/annotations")
    public ResponseEntity<List<Annotation>> list(@PathVariable String id) {
        return ResponseEntity.ok(annotationService.list(id));
    }

    // -------------------------------------------------------------------------
    // POST /api/documents/{id}/annotate
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -X POST http://localhost:8889/api/documents/3f2a.../annotate \
     *        -H "Content-Type: application/json" \
     *        -d '{"startPosition": 120, "endPosition": 180, "highlightedText": "...",
     *             "category": "evidence", "note": "dato chiave"}'
     */
    @PostMapping("/documents/{id}/annotate")
    public ResponseEntity<Annotation> create(@PathVariable String id, @RequestBody AnnotationRequest request) {
        if (request.startPosition() == null || request.endPosition() == null
                || isBlank(request.highlightedText()) || isBlank(request.category()) || isBlank(request.note())) {
            throw new IllegalArgumentException("Campi obbligatori mancanti");
        }
        Annotation created = annotationService.create(id,
                request.startPosition(), request.endPosition(), request.highlightedText(),
                AnnotationCategory.fromWire(request.category()), request.note(), request.searchableContent());
        return ResponseEntity.ok(created);
    }

    // -------------------------------------------------------------------------
    // PUT /api/annotations/{id}
    // -------------------------------------------------------------------------

    @PutMapping("/annotations/{id}")
    public ResponseEntity<Annotation> update(@PathVariable String id, @RequestBody AnnotationUpdateRequest request) {
        if (isBlank(request.note()) || isBlank(request.category())) {
            throw new IllegalArgumentException("Nota e categoria sono obbligatorie");
        }
        return ResponseEntity.ok(annotationService.update(id, request.note(),
                AnnotationCategory.fromWire(request.category())));
    }

    // -------------------------------------------------------------------------
    // DELETE /api/annotations/{id}
    // -------------------------------------------------------------------------

    @DeleteMapping("/annotations/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        annotationService.delete(id);
        return ResponseEntity.noContent().build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

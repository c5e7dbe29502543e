package it.aw.annotator.model;

import java.time.LocalDateTime;

/**
 * Evidenziazione persistita su un documento: span, categoria e nota.
 * <p>
 * Le annotazioni generate dalla pipeline ({@code aiGenerated = true}) vengono
 * sostituite a ogni nuovo intent; quelle dell'utente sono conservate.
 */
public record Annotation(
        String             id,
        String             documentId,
        int                startPosition,
        int                endPosition,
        String             highlightedText,
        AnnotationCategory category,
        String             note,
        String             searchableContent,  // testo extra indicizzabile (null se assente)
        boolean            aiGenerated,
        Double             confidenceScore,    // null per annotazioni manuali
        LocalDateTime      createdAt
) {

    public Annotation withNoteAndCategory(String newNote, AnnotationCategory newCategory) {
        return new Annotation(id, documentId, startPosition, endPosition, highlightedText,
                newCategory, newNote, searchableContent, aiGenerated, confidenceScore, createdAt);
    }

    /** True se lo span si sovrappone a {@code [start, end)}. */
    public boolean overlaps(int start, int end) {
        return startPosition < end && start < endPosition;
    }
}

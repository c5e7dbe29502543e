package it.aw.annotator.controller.dto;

/**
 * Corpo di POST /api/documents/{id}/annotate.
 * La categoria arriva come stringa e viene validata dal controller.
 */
public record AnnotationRequest(
        Integer startPosition,
        Integer endPosition,
        String  highlightedText,
        String  category,
        String  note,
        String  searchableContent
) {}

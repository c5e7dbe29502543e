package it.aw.annotator.model;

/**
 * Span restituito dalla pipeline di annotazione, con offset assoluti nel fullText.
 */
public record AnnotationSpan(
        int                absoluteStart,
        int                absoluteEnd,
        String             highlightText,
        AnnotationCategory category,
        String             note,
        double             confidence
) {}

package it.aw.annotator.model;

/**
 * Segmento prodotto dal chunker, non ancora persistito.
 * Gli offset sono relativi al testo completo del documento: {@code [startPosition, endPosition)}.
 */
public record TextChunk(
        String text,
        int    startPosition,
        int    endPosition
) {}

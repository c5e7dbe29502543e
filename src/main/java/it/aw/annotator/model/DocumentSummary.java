package it.aw.annotator.model;

import java.time.LocalDateTime;

/**
 * Vista leggera di un documento: metadati e contatori, senza testo completo.
 */
public record DocumentSummary(
        String        id,
        String        filename,
        String        userIntent,
        String        summary,
        int           chunkCount,
        int           textLength,
        LocalDateTime uploadedAt
) {}

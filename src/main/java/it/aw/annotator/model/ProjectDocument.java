package it.aw.annotator.model;

/**
 * Collegamento tra un progetto e un documento caricato.
 * <p>
 * filename e summary sono copiati dal documento al momento della lettura
 * (join), non persistiti sul collegamento.
 */
public record ProjectDocument(
        String id,
        String projectId,
        String documentId,
        String folderId,          // null se il documento non è in una cartella
        String retrievalContext,
        String filename,
        String summary
) {}

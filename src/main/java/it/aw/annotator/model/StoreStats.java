package it.aw.annotator.model;

/**
 * Statistiche aggregate sullo stato dello store.
 */
public record StoreStats(
        int totalDocuments,
        int totalChunks,
        int embeddedChunks,
        int totalAnnotations,
        int totalProjects,
        String storeType,
        String embeddingModel
) {}

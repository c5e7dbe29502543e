package it.aw.annotator.model;

/**
 * Cartella di un progetto.
 */
public record Folder(
        String id,
        String projectId,
        String name,
        String description,
        String contextSummary
) {}

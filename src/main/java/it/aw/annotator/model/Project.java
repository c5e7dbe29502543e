package it.aw.annotator.model;

import java.time.LocalDateTime;

/**
 * Progetto di ricerca: raccoglie documenti e cartelle attorno a una tesi.
 */
public record Project(
        String        id,
        String        name,
        String        thesis,
        String        contextSummary,
        LocalDateTime createdAt
) {}

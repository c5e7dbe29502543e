package it.aw.annotator.model;

import java.util.List;

/**
 * Vista completa di un progetto: cartelle e documenti collegati.
 */
public record ProjectOverview(
        Project               project,
        List<Folder>          folders,
        List<ProjectDocument> documents
) {}

package it.aw.annotator.model;

/**
 * Annotazione letta attraverso il collegamento progetto-documento che la rende visibile nel progetto.
 */
public record LinkedAnnotation(ProjectDocument link, Annotation annotation) {}

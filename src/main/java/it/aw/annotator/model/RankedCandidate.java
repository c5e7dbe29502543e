package it.aw.annotator.model;

/**
 * Chunk con la sua similarità coseno rispetto al vettore di query, in [-1, 1].
 */
public record RankedCandidate(Chunk chunk, double similarity) {}

package it.aw.annotator.controller.dto;

import it.aw.annotator.model.SearchFilters;

/** Corpo di POST /api/projects/{id}/search. filters e limit sono opzionali. */
public record GlobalSearchRequest(String query, SearchFilters filters, Integer limit) {}

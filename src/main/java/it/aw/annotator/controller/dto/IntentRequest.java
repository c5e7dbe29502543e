package it.aw.annotator.controller.dto;

/** Corpo di POST /api/documents/{id}/set-intent. thoroughness è opzionale. */
public record IntentRequest(String intent, String thoroughness) {}

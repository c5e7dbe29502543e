package it.aw.annotator.controller.dto;

/** Corpo JSON di tutte le risposte di errore: {@code {"message": "..."}}. */
public record ErrorResponse(String message) {}

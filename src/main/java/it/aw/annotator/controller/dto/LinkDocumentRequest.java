package it.aw.annotator.controller.dto;

/** Collega un documento caricato a un progetto; folderId è opzionale. */
public record LinkDocumentRequest(String documentId, String folderId, String retrievalContext) {}

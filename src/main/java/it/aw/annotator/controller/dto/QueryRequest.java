package it.aw.annotator.controller.dto;

/** Corpo delle ricerche su singolo documento. */
public record QueryRequest(String query) {}

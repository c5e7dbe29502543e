package it.aw.annotator.controller.dto;

public record AnnotationUpdateRequest(String note, String category) {}

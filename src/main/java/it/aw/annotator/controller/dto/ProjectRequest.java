package it.aw.annotator.controller.dto;

public record ProjectRequest(String name, String thesis, String contextSummary) {}

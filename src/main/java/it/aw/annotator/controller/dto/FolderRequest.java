package it.aw.annotator.controller.dto;

public record FolderRequest(String name, String description, String contextSummary) {}

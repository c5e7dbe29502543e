package it.aw.annotator.model;

import java.util.List;

/**
 * Sintesi di un documento prodotta dal modello di chat.
 */
public record DocumentDigest(
        String       summary,
        List<String> mainArguments,
        List<String> keyConcepts
) {}

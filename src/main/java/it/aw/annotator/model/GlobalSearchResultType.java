package it.aw.annotator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Variante di un risultato della ricerca globale.
 * Il contesto di progetto e quello di cartella condividono {@link #FOLDER_CONTEXT}:
 * il primo si riconosce dall'assenza di folderId.
 */
public enum GlobalSearchResultType {

    FOLDER_CONTEXT,
    DOCUMENT_CONTEXT,
    ANNOTATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

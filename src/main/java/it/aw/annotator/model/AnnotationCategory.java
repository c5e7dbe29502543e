package it.aw.annotator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Categorie di annotazione. Il valore wire è snake_case minuscolo.
 */
public enum AnnotationCategory {

    KEY_QUOTE,
    ARGUMENT,
    EVIDENCE,
    METHODOLOGY,
    USER_ADDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException se il valore non corrisponde a nessuna categoria
     */
    @JsonCreator
    public static AnnotationCategory fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("categoria mancante");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

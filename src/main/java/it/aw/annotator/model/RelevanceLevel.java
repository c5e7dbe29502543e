package it.aw.annotator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fascia di rilevanza grossolana derivata da un punteggio continuo.
 */
public enum RelevanceLevel {

    HIGH,
    MEDIUM,
    LOW;

    /** >= 0.7 high, >= 0.5 medium, altrimenti low. */
    public static RelevanceLevel fromScore(double score) {
        if (score >= 0.7) return HIGH;
        if (score >= 0.5) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parsing tollerante dei valori restituiti dal modello di chat: default LOW. */
    @JsonCreator
    public static RelevanceLevel fromWire(String value) {
        if (value == null) return LOW;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }
}

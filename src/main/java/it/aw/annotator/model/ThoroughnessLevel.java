package it.aw.annotator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Politica di selezione dei chunk candidati: quanti al massimo e con quale
 * similarità minima. Aggiungere un livello significa aggiungere una riga qui.
 */
public enum ThoroughnessLevel {

    QUICK      (10,                0.3),
    STANDARD   (30,                0.3),
    THOROUGH   (100,               0.3),
    EXHAUSTIVE (Integer.MAX_VALUE, 0.1);

    private final int    maxChunks;
    private final double minSimilarity;

    ThoroughnessLevel(int maxChunks, double minSimilarity) {
        this.maxChunks = maxChunks;
        this.minSimilarity = minSimilarity;
    }

    public int maxChunks() {
        return maxChunks;
    }

    public double minSimilarity() {
        return minSimilarity;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Risolve il livello dal valore testuale. Valori nulli o sconosciuti
     * ricadono su {@link #STANDARD}: il livello è un'indicazione di UX, non un vincolo.
     */
    public static ThoroughnessLevel parse(String value) {
        if (value == null) return STANDARD;
        for (ThoroughnessLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.trim())) return level;
        }
        return STANDARD;
    }

    public static boolean isKnown(String value) {
        if (value == null) return false;
        for (ThoroughnessLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.trim())) return true;
        }
        return false;
    }
}

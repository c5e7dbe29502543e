package it.aw.annotator.service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Riconosce il testo "spazzatura" prodotto da un'estrazione PDF fallita
 * (scansioni, font con encoding custom).
 * <p>
 * Analizza solo i primi {@value #SAMPLE_LENGTH} caratteri. Il testo è considerato
 * illeggibile se:
 * <ul>
 *   <li>meno del 40% dei caratteri non-spazio forma parole di almeno 3 lettere;</li>
 *   <li>oppure più del 10% sono simboli/parentesi insoliti;</li>
 *   <li>oppure ci sono più di 10 parole e la lunghezza media è sotto 3.</li>
 * </ul>
 */
public final class GarbledTextDetector {

    static final int SAMPLE_LENGTH = 2000;
    static final int MIN_LENGTH    = 100;

    private static final Pattern WORD       = Pattern.compile("[a-zA-Z]{3,}");
    private static final Pattern SYMBOL     = Pattern.compile("[\\[\\]{}\\\\|^~`@#$%&*+=<>]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private GarbledTextDetector() {}

    /**
     * @return false per testo nullo o più corto di {@value #MIN_LENGTH} caratteri
     *         (troppo poco segnale per giudicare)
     */
    public static boolean isGarbled(String text) {
        if (text == null || text.length() < MIN_LENGTH) {
            return false;
        }
        String sample = text.substring(0, Math.min(SAMPLE_LENGTH, text.length()));

        int wordCount = 0;
        int wordChars = 0;
        Matcher words = WORD.matcher(sample);
        while (words.find()) {
            wordCount++;
            wordChars += words.end() - words.start();
        }

        int symbols = 0;
        Matcher symbolMatcher = SYMBOL.matcher(sample);
        while (symbolMatcher.find()) {
            symbols++;
        }

        int totalChars = WHITESPACE.matcher(sample).replaceAll("").length();
        double wordRatio    = totalChars > 0 ? (double) wordChars / totalChars : 0;
        double symbolRatio  = totalChars > 0 ? (double) symbols / totalChars : 0;
        double avgWordLen   = wordCount > 0 ? (double) wordChars / wordCount : 0;

        return wordRatio < 0.4 || symbolRatio > 0.1 || (wordCount > 10 && avgWordLen < 3);
    }
}

package it.aw.annotator.service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Punteggio lessicale query/testo, senza chiamate esterne.
 * <p>
 * Sottostringa esatta (case-insensitive): 0.9. Altrimenti si contano le parole
 * della query più lunghe di 2 caratteri presenti nel testo; sotto il 50% il
 * risultato è soppresso (0), sopra vale {@code 0.6 * matchRatio}.
 */
public final class TextMatchScorer {

    static final double TEXT_MATCH_SCORE  = 0.6;
    static final double EXACT_MATCH_BONUS = 0.3;
    static final double MIN_MATCH_RATIO   = 0.5;

    private static final Pattern WORD_SEPARATOR = Pattern.compile("\\s+");

    private TextMatchScorer() {}

    /**
     * @return punteggio in [0, 0.9]; 0 per query o testo vuoti
     */
    public static double score(String query, String text) {
        if (query == null || query.isBlank() || text == null || text.isEmpty()) {
            return 0;
        }
        String queryLower = query.toLowerCase(Locale.ROOT);
        String textLower  = text.toLowerCase(Locale.ROOT);

        if (textLower.contains(queryLower)) {
            return TEXT_MATCH_SCORE + EXACT_MATCH_BONUS;
        }

        int total = 0;
        int matched = 0;
        for (String word : WORD_SEPARATOR.split(queryLower)) {
            if (word.length() <= 2) continue;
            total++;
            if (textLower.contains(word)) matched++;
        }
        if (total == 0) {
            return 0;
        }
        double matchRatio = (double) matched / total;
        return matchRatio >= MIN_MATCH_RATIO ? TEXT_MATCH_SCORE * matchRatio : 0;
    }
}

package it.aw.annotator.model;

/**
 * Risultato della ricerca semantica su un singolo documento: una citazione
 * estratta dal modello di chat, con spiegazione e posizione nel fullText.
 * <p>
 * La rilevanza qui è il giudizio del modello, non una soglia sul punteggio
 * coseno: non confrontarla con {@link GlobalSearchResult#relevanceLevel()}.
 */
public record SearchResult(
        String         quote,
        String         explanation,
        RelevanceLevel relevance,
        int            startPosition,
        int            endPosition
) {}

package it.aw.annotator.model;

import java.util.List;

/**
 * Risposta della ricerca globale.
 *
 * @param totalResults numero di risultati prima del troncamento a {@code limit}
 * @param searchTime   durata dell'intera operazione in millisecondi
 */
public record GlobalSearchResponse(
        List<GlobalSearchResult> results,
        int                      totalResults,
        long                     searchTime
) {

    public static GlobalSearchResponse empty(long searchTime) {
        return new GlobalSearchResponse(List.of(), 0, searchTime);
    }
}

package it.aw.annotator.service;

import it.aw.annotator.model.GlobalSearchResult;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Una sorgente della ricerca globale: gli elementi da valutare, il filtro che li
 * ammette, i campi di testo in ordine di priorità e come trasformare un match
 * in risultato.
 * <p>
 * Il testo valutato è la concatenazione dei campi non vuoti; il matchedText
 * restituito è il primo campo non vuoto.
 */
record SearchSource<T>(
        String                    name,
        List<T>                   items,
        Predicate<T>              admits,
        Function<T, List<String>> fields,
        ResultFactory<T>          toResult
) {

    @FunctionalInterface
    interface ResultFactory<T> {
        GlobalSearchResult create(T item, String matchedText, double score);
    }
}

package it.aw.annotator.llm;

import it.aw.annotator.model.Chunk;
import it.aw.annotator.model.SearchResult;

import java.util.List;

/**
 * Trova nei chunk candidati le citazioni che rispondono a una query.
 */
public interface QuoteExtractor {

    /**
     * @param query           domanda dell'utente
     * @param researchContext tesi del progetto o intent del documento, può essere vuoto
     * @param rankedChunks    candidati già ordinati per similarità
     * @return citazioni con offset assoluti nel fullText del documento
     */
    List<SearchResult> extractQuotes(String query, String researchContext, List<Chunk> rankedChunks);
}

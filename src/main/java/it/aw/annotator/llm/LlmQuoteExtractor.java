package it.aw.annotator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.input.PromptTemplate;
import it.aw.annotator.model.Chunk;
import it.aw.annotator.model.RelevanceLevel;
import it.aw.annotator.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link QuoteExtractor} basato sul modello di chat.
 * <p>
 * I passaggi vengono numerati nel prompt; il modello risponde con il numero del
 * passaggio e la citazione letterale, che viene poi ritrovata nel testo del chunk
 * per calcolare gli offset assoluti. Le citazioni non ritrovate vengono scartate.
 */
@Component
public class LlmQuoteExtractor implements QuoteExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmQuoteExtractor.class);

    private static final PromptTemplate PROMPT = PromptTemplate.from("""
            You are a research assistant. Find the quotes that best answer the query.

            Query: {{query}}
            Research context: {{context}}

            Passages:
            {{passages}}

            Reply with JSON only, in this shape:
            {"results": [{"passage": 1, "quote": "exact text copied from the passage", \
            "explanation": "why it answers the query", "relevance": "high|medium|low"}]}
            Quotes must be copied verbatim from a single passage. Return an empty list if nothing is relevant.
            """);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QuoteReply(List<QuoteItem> results) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QuoteItem(Integer passage, String quote, String explanation, String relevance) {}

    private final ChatLanguageModel chatModel;
    private final LlmReplyParser parser;

    public LlmQuoteExtractor(ChatLanguageModel chatModel, LlmReplyParser parser) {
        this.chatModel = chatModel;
        this.parser = parser;
    }

    @Override
    public List<SearchResult> extractQuotes(String query, String researchContext, List<Chunk> rankedChunks) {
        if (rankedChunks.isEmpty()) {
            return List.of();
        }
        StringBuilder passages = new StringBuilder();
        for (int i = 0; i < rankedChunks.size(); i++) {
            passages.append('[').append(i + 1).append("] ").append(rankedChunks.get(i).text()).append("\n\n");
        }
        String prompt = PROMPT.apply(Map.of(
                "query", query,
                "context", researchContext != null && !researchContext.isBlank() ? researchContext : "(none)",
                "passages", passages.toString().trim()
        )).text();

        QuoteReply reply = parser.parse(chatModel.generate(prompt), QuoteReply.class);
        if (reply.results() == null) {
            return List.of();
        }

        List<SearchResult> results = new ArrayList<>();
        for (QuoteItem item : reply.results()) {
            String quote = TextLocator.clean(item.quote());
            SearchResult located = locate(item, quote, rankedChunks);
            if (located != null) {
                results.add(located);
            } else {
                log.warn("Citazione non trovata nei passaggi, scartata: '{}'", abbreviate(quote));
            }
        }
        log.debug("QuoteExtractor: {} citazioni su {} proposte", results.size(), reply.results().size());
        return results;
    }

    /** Cerca prima nel passaggio indicato dal modello, poi in tutti gli altri. */
    private SearchResult locate(QuoteItem item, String quote, List<Chunk> chunks) {
        if (quote.isEmpty()) return null;
        List<Chunk> order = new ArrayList<>(chunks);
        Integer passage = item.passage();
        if (passage != null && passage >= 1 && passage <= chunks.size()) {
            Chunk hinted = chunks.get(passage - 1);
            order.remove(hinted);
            order.add(0, hinted);
        }
        for (Chunk chunk : order) {
            int idx = TextLocator.locate(chunk.text(), quote);
            if (idx >= 0 && idx + quote.length() <= chunk.text().length()) {
                int start = chunk.startPosition() + idx;
                return new SearchResult(
                        chunk.text().substring(idx, idx + quote.length()),
                        item.explanation() != null ? item.explanation() : "",
                        RelevanceLevel.fromWire(item.relevance()),
                        start,
                        start + quote.length());
            }
        }
        return null;
    }

    private static String abbreviate(String s) {
        return s.length() > 60 ? s.substring(0, 60) + "..." : s;
    }
}

package it.aw.annotator.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import it.aw.annotator.model.Chunk;
import it.aw.annotator.model.RelevanceLevel;
import it.aw.annotator.model.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LlmQuoteExtractorTest {

    private static final Chunk FIRST  = new Chunk("c1", "doc", 3, "Offices distract people.", 100, 124, null);
    private static final Chunk SECOND = new Chunk("c2", "doc", 0, "Remote work raised output by 13%.", 0, 33, null);

    @Mock
    private ChatLanguageModel chatModel;

    private LlmQuoteExtractor extractor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        extractor = new LlmQuoteExtractor(chatModel, new LlmReplyParser(new ObjectMapper()));
    }

    @Test
    void locatesQuotesAndComputesAbsoluteOffsets() {
        when(chatModel.generate(anyString())).thenReturn("""
                {"results": [
                  {"passage": 2, "quote": "\\"raised output by 13%\\"", "explanation": "dato", "relevance": "high"},
                  {"passage": 1, "quote": "offices DISTRACT", "explanation": "contesto", "relevance": "medium"}
                ]}
                """);

        List<SearchResult> results = extractor.extractQuotes("produttività", "lavoro remoto", List.of(FIRST, SECOND));

        assertEquals(2, results.size());
        SearchResult stat = results.get(0);
        assertEquals("raised output by 13%", stat.quote());
        assertEquals(12, stat.startPosition());
        assertEquals(32, stat.endPosition());
        assertEquals(RelevanceLevel.HIGH, stat.relevance());

        SearchResult offices = results.get(1);
        assertEquals("Offices distract", offices.quote());
        assertEquals(100, offices.startPosition());
        assertEquals(116, offices.endPosition());
        assertEquals(RelevanceLevel.MEDIUM, offices.relevance());
    }

    @Test
    void wrongPassageHintStillFindsTheQuote() {
        when(chatModel.generate(anyString())).thenReturn(
                "{\"results\": [{\"passage\": 1, \"quote\": \"Remote work\", \"relevance\": \"low\"}]}");

        List<SearchResult> results = extractor.extractQuotes("q", "", List.of(FIRST, SECOND));

        assertEquals(1, results.size());
        assertEquals(0, results.get(0).startPosition());
        assertEquals("", results.get(0).explanation());
    }

    @Test
    void inventedQuotesAreDropped() {
        when(chatModel.generate(anyString())).thenReturn(
                "{\"results\": [{\"passage\": 1, \"quote\": \"not in any passage\", \"relevance\": \"high\"}]}");

        assertTrue(extractor.extractQuotes("q", "ctx", List.of(FIRST, SECOND)).isEmpty());
    }

    @Test
    void promptNumbersPassagesAndCarriesContext() {
        when(chatModel.generate(anyString())).thenReturn("{\"results\": []}");

        extractor.extractQuotes("produttività", "  ", List.of(FIRST, SECOND));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).generate(prompt.capture());
        assertTrue(prompt.getValue().contains("[1] Offices distract people."));
        assertTrue(prompt.getValue().contains("[2] Remote work raised output by 13%."));
        assertTrue(prompt.getValue().contains("Research context: (none)"));
    }

    @Test
    void noChunksMeansNoCall() {
        assertTrue(extractor.extractQuotes("q", "ctx", List.of()).isEmpty());
        verifyNoInteractions(chatModel);
    }
}

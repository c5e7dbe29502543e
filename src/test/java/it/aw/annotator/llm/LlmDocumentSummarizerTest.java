package it.aw.annotator.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import it.aw.annotator.model.DocumentDigest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LlmDocumentSummarizerTest {

    @Mock
    private ChatLanguageModel chatModel;

    private LlmDocumentSummarizer summarizer;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        summarizer = new LlmDocumentSummarizer(chatModel, new LlmReplyParser(new ObjectMapper()));
    }

    @Test
    void missingListsBecomeEmpty() {
        when(chatModel.generate(anyString())).thenReturn("{\"summary\": \"Studio sul lavoro remoto\"}");

        DocumentDigest digest = summarizer.summarize("testo");

        assertEquals("Studio sul lavoro remoto", digest.summary());
        assertEquals(List.of(), digest.mainArguments());
        assertEquals(List.of(), digest.keyConcepts());
    }

    @Test
    void longDocumentsAreTruncatedInThePrompt() {
        when(chatModel.generate(anyString())).thenReturn("{\"summary\": \"s\"}");

        summarizer.summarize("a".repeat(20_000));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).generate(prompt.capture());
        assertFalse(prompt.getValue().contains("a".repeat(LlmDocumentSummarizer.MAX_INPUT_CHARS + 1)));
        assertTrue(prompt.getValue().contains("a".repeat(LlmDocumentSummarizer.MAX_INPUT_CHARS)));
    }
}

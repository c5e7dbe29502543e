package it.aw.annotator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.input.PromptTemplate;
import it.aw.annotator.model.DocumentDigest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Sintesi del documento via modello di chat, sui primi {@value #MAX_INPUT_CHARS} caratteri.
 */
@Component
public class LlmDocumentSummarizer implements DocumentSummarizer {

    static final int MAX_INPUT_CHARS = 8000;

    private static final PromptTemplate PROMPT = PromptTemplate.from("""
            Summarize the following document for a researcher.

            {{text}}

            Reply with JSON only, in this shape:
            {"summary": "2-3 sentences", "mainArguments": ["..."], "keyConcepts": ["..."]}
            """);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DigestReply(String summary, List<String> mainArguments, List<String> keyConcepts) {}

    private final ChatLanguageModel chatModel;
    private final LlmReplyParser parser;

    public LlmDocumentSummarizer(ChatLanguageModel chatModel, LlmReplyParser parser) {
        this.chatModel = chatModel;
        this.parser = parser;
    }

    @Override
    public DocumentDigest summarize(String fullText) {
        String excerpt = fullText.length() > MAX_INPUT_CHARS ? fullText.substring(0, MAX_INPUT_CHARS) : fullText;
        DigestReply reply = parser.parse(chatModel.generate(PROMPT.apply(Map.of("text", excerpt)).text()),
                DigestReply.class);
        return new DocumentDigest(
                reply.summary(),
                reply.mainArguments() != null ? reply.mainArguments() : List.of(),
                reply.keyConcepts() != null ? reply.keyConcepts() : List.of());
    }
}

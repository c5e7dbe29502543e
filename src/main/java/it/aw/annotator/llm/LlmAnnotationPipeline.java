package it.aw.annotator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.input.PromptTemplate;
import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.AnnotationCategory;
import it.aw.annotator.model.AnnotationSpan;
import it.aw.annotator.model.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link AnnotationPipeline} basata sul modello di chat: una chiamata per chunk.
 * <p>
 * Ogni evidenziazione proposta viene ritrovata nel testo del chunk e convertita
 * in offset assoluti. Vengono scartati gli span non ritrovati, quelli con
 * categoria sconosciuta, quelli sovrapposti a un'annotazione dell'utente e
 * quelli sovrapposti a uno span già accettato (i chunk si sovrappongono).
 */
@Component
public class LlmAnnotationPipeline implements AnnotationPipeline {

    private static final Logger log = LoggerFactory.getLogger(LlmAnnotationPipeline.class);

    private static final PromptTemplate PROMPT = PromptTemplate.from("""
            You are annotating a document for a researcher.

            Research intent: {{intent}}

            Passage:
            {{passage}}

            Highlight the sentences of the passage that matter for the intent.
            Reply with JSON only, in this shape:
            {"annotations": [{"highlight": "exact text copied from the passage", \
            "category": "key_quote|argument|evidence|methodology", \
            "note": "short note for the researcher", "confidence": 0.0}]}
            Return an empty list if nothing in the passage is relevant.
            """);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HighlightReply(List<HighlightItem> annotations) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HighlightItem(String highlight, String category, String note, Double confidence) {}

    private final ChatLanguageModel chatModel;
    private final LlmReplyParser parser;

    public LlmAnnotationPipeline(ChatLanguageModel chatModel, LlmReplyParser parser) {
        this.chatModel = chatModel;
        this.parser = parser;
    }

    @Override
    public List<AnnotationSpan> run(List<Chunk> topChunks, String intent, String documentId,
                                    String fullText, List<Annotation> priorUserAnnotations) {
        List<AnnotationSpan> accepted = new ArrayList<>();
        for (Chunk chunk : topChunks) {
            String prompt = PROMPT.apply(Map.of("intent", intent, "passage", chunk.text())).text();
            HighlightReply reply = parser.parse(chatModel.generate(prompt), HighlightReply.class);
            if (reply.annotations() == null) continue;

            for (HighlightItem item : reply.annotations()) {
                AnnotationSpan span = toSpan(item, chunk, fullText);
                if (span == null) continue;
                if (overlapsAny(span, priorUserAnnotations, accepted)) {
                    log.debug("Span [{}, {}) sovrapposto a uno esistente, scartato",
                            span.absoluteStart(), span.absoluteEnd());
                    continue;
                }
                accepted.add(span);
            }
        }
        log.info("Pipeline di annotazione: {} span da {} chunk (documentId={})",
                accepted.size(), topChunks.size(), documentId);
        return accepted;
    }

    private AnnotationSpan toSpan(HighlightItem item, Chunk chunk, String fullText) {
        String highlight = TextLocator.clean(item.highlight());
        int idx = TextLocator.locate(chunk.text(), highlight);
        if (idx < 0) {
            log.warn("Evidenziazione non trovata nel chunk {}, scartata", chunk.chunkIndex());
            return null;
        }
        int start = chunk.startPosition() + idx;
        int end = start + highlight.length();
        if (end > fullText.length()) return null;

        AnnotationCategory category;
        try {
            category = AnnotationCategory.fromWire(item.category());
        } catch (IllegalArgumentException e) {
            log.warn("Categoria '{}' non riconosciuta, evidenziazione scartata", item.category());
            return null;
        }
        double confidence = item.confidence() != null ? Math.max(0.0, Math.min(1.0, item.confidence())) : 0.5;
        return new AnnotationSpan(start, end, fullText.substring(start, end), category,
                item.note() != null ? item.note() : "", confidence);
    }

    private static boolean overlapsAny(AnnotationSpan span, List<Annotation> prior, List<AnnotationSpan> accepted) {
        for (Annotation a : prior) {
            if (a.overlaps(span.absoluteStart(), span.absoluteEnd())) return true;
        }
        for (AnnotationSpan s : accepted) {
            if (s.absoluteStart() < span.absoluteEnd() && span.absoluteStart() < s.absoluteEnd()) return true;
        }
        return false;
    }
}

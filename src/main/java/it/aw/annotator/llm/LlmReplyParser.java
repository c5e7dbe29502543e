package it.aw.annotator.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.annotator.exception.LlmResponseException;
import org.springframework.stereotype.Component;

/**
 * Estrae l'oggetto JSON dalla risposta del modello di chat, ignorando
 * eventuali blocchi markdown o testo attorno.
 */
@Component
public class LlmReplyParser {

    private final ObjectMapper objectMapper;

    public LlmReplyParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws LlmResponseException se la risposta non contiene un oggetto JSON valido
     */
    public <T> T parse(String reply, Class<T> type) {
        if (reply == null) {
            throw new LlmResponseException("Risposta vuota dal modello", null);
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new LlmResponseException("Nessun oggetto JSON nella risposta del modello", null);
        }
        try {
            return objectMapper.readValue(reply.substring(start, end + 1), type);
        } catch (JsonProcessingException e) {
            throw new LlmResponseException("JSON non valido nella risposta del modello", e);
        }
    }
}

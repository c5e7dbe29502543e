package it.aw.annotator.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Documento caricato, incluso il testo completo estratto.
 * <p>
 * Il fullText è lo spazio di coordinate comune a chunk e annotazioni:
 * tutti gli offset del sistema si riferiscono a questa stringa.
 * Per le liste usare {@link DocumentSummary}, che non porta il testo.
 */
public record DocumentRecord(
        String        id,
        String        filename,
        String        fullText,
        String        userIntent,     // null finché l'utente non imposta un intent
        String        summary,        // generato in background, può restare null
        List<String>  mainArguments,
        List<String>  keyConcepts,
        int           chunkCount,
        LocalDateTime uploadedAt
) {
    /** Proietta il record nella vista leggera senza testo. */
    public DocumentSummary toSummary() {
        return new DocumentSummary(id, filename, userIntent, summary, chunkCount,
                fullText != null ? fullText.length() : 0, uploadedAt);
    }
}

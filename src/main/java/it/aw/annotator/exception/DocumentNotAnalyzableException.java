package it.aw.annotator.exception;

/**
 * Il documento esiste ma non ha testo su cui lavorare (nessun chunk).
 */
public class DocumentNotAnalyzableException extends RuntimeException {

    public DocumentNotAnalyzableException(String message) {
        super(message);
    }
}

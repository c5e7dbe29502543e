package it.aw.annotator.exception;

/**
 * Risposta del modello di chat non interpretabile.
 */
public class LlmResponseException extends RuntimeException {

    public LlmResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}

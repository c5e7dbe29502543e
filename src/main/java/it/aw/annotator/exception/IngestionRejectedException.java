package it.aw.annotator.exception;

/**
 * Il file caricato non produce testo utilizzabile. Il messaggio è destinato
 * all'utente finale e indica come rimediare; non va ritentato automaticamente.
 */
public class IngestionRejectedException extends RuntimeException {

    public IngestionRejectedException(String message) {
        super(message);
    }
}

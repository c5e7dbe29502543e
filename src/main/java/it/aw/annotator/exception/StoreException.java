package it.aw.annotator.exception;

/**
 * Errore di accesso allo store DuckDB.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

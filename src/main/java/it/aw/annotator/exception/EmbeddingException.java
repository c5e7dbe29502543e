package it.aw.annotator.exception;

/**
 * Il provider di embedding ha restituito vettori inutilizzabili
 * (numero errato, dimensioni incompatibili con quelli salvati).
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }
}

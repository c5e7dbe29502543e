package it.aw.annotator.exception;

/**
 * Entità richiesta inesistente, per operazioni che ne richiedono una precisa.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException document(String id) {
        return new NotFoundException("Documento non trovato: " + id);
    }

    public static NotFoundException projectDocument(String id) {
        return new NotFoundException("Documento di progetto non trovato: " + id);
    }

    public static NotFoundException project(String id) {
        return new NotFoundException("Progetto non trovato: " + id);
    }

    public static NotFoundException annotation(String id) {
        return new NotFoundException("Annotazione non trovata: " + id);
    }
}

package it.aw.annotator.model;

/**
 * Parametri di chunking per una singola operazione di ingestione.
 * <p>
 * L'overlap deve restare strettamente minore di chunkSize: altrimenti il cursore
 * del chunker non avanzerebbe e il partizionamento non terminerebbe.
 */
public record ChunkingParams(int chunkSize, int overlap) {

    public static final int DEFAULT_CHUNK_SIZE = 500;
    public static final int DEFAULT_OVERLAP    = 50;

    /** Costruttore compatto con validazione. */
    public ChunkingParams {
        if (chunkSize < 50) {
            throw new IllegalArgumentException("chunkSize deve essere >= 50 (ricevuto: " + chunkSize + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap deve essere >= 0 (ricevuto: " + overlap + ")");
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") deve essere < chunkSize (" + chunkSize + ")");
        }
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }
}

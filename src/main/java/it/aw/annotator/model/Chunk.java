package it.aw.annotator.model;

/**
 * Chunk persistito di un documento.
 * <p>
 * L'embedding è assente finché non viene richiesto la prima volta
 * (vedi {@code ChunkEmbeddingService}); una volta calcolato non cambia più.
 */
public record Chunk(
        String  id,
        String  documentId,
        int     chunkIndex,     // posizione 0-based nella sequenza del documento
        String  text,
        int     startPosition,  // offset inclusivo nel fullText
        int     endPosition,    // offset esclusivo nel fullText
        float[] embedding       // null finché non calcolato
) {

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public Chunk withEmbedding(float[] vector) {
        return new Chunk(id, documentId, chunkIndex, text, startPosition, endPosition, vector);
    }
}

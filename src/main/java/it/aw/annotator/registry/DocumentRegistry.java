package it.aw.annotator.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.annotator.exception.StoreException;
import it.aw.annotator.model.Chunk;
import it.aw.annotator.model.DocumentDigest;
import it.aw.annotator.model.DocumentRecord;
import it.aw.annotator.model.DocumentSummary;
import it.aw.annotator.model.TextChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registro dei documenti caricati e dei loro chunk, nelle tabelle
 * {@code documents} e {@code chunks} dello store DuckDB.
 * <p>
 * I chunk vengono creati in blocco, in una sola transazione, subito dopo
 * l'ingestione; l'embedding viene scritto dopo, una volta per chunk.
 * Vettori ed elenchi sono serializzati in JSON nelle colonne VARCHAR.
 */
@Component
public class DocumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(DocumentRegistry.class);

    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private static final String DOCUMENT_COLUMNS =
            "id, filename, full_text, user_intent, summary, main_arguments, key_concepts, chunk_count, uploaded_at";

    private final DuckDbStore store;
    private final ObjectMapper objectMapper;

    public DocumentRegistry(DuckDbStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Salva il documento e i suoi chunk; chunkCount viene preso dalla lista.
     *
     * @return i chunk persistiti, nello stesso ordine dell'input
     */
    public List<Chunk> register(DocumentRecord record, List<TextChunk> textChunks) {
        return store.inTransaction("salvataggio documento " + record.id(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO documents (" + DOCUMENT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, record.id());
                ps.setString(2, record.filename());
                ps.setString(3, record.fullText());
                setNullableString(ps, 4, record.userIntent());
                setNullableString(ps, 5, record.summary());
                setNullableString(ps, 6, record.mainArguments() != null ? toJson(record.mainArguments()) : null);
                setNullableString(ps, 7, record.keyConcepts() != null ? toJson(record.keyConcepts()) : null);
                ps.setInt(8, textChunks.size());
                ps.setTimestamp(9, Timestamp.valueOf(record.uploadedAt()));
                ps.executeUpdate();
            }

            List<Chunk> saved = new ArrayList<>(textChunks.size());
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO chunks (id, document_id, chunk_index, text, start_position, end_position, embedding) " +
                    "VALUES (?, ?, ?, ?, ?, ?, NULL)")) {
                for (int i = 0; i < textChunks.size(); i++) {
                    TextChunk tc = textChunks.get(i);
                    Chunk chunk = new Chunk(UUID.randomUUID().toString(), record.id(), i,
                            tc.text(), tc.startPosition(), tc.endPosition(), null);
                    ps.setString(1, chunk.id());
                    ps.setString(2, chunk.documentId());
                    ps.setInt(3, chunk.chunkIndex());
                    ps.setString(4, chunk.text());
                    ps.setInt(5, chunk.startPosition());
                    ps.setInt(6, chunk.endPosition());
                    ps.executeUpdate();
                    saved.add(chunk);
                }
            }
            log.debug("DocumentRegistry: documento {} salvato con {} chunk", record.id(), saved.size());
            return saved;
        });
    }

    public Optional<DocumentRecord> findById(String documentId) {
        return store.execute("lettura documento " + documentId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + DOCUMENT_COLUMNS + " FROM documents WHERE id = ?")) {
                ps.setString(1, documentId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) return Optional.of(toRecord(rs));
                }
            }
            return Optional.empty();
        });
    }

    public boolean exists(String documentId) {
        return store.execute("verifica documento " + documentId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM documents WHERE id = ?")) {
                ps.setString(1, documentId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    public List<DocumentSummary> findAllAsSummary() {
        return store.execute("lettura registry (summary)", conn -> {
            List<DocumentSummary> result = new ArrayList<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(
                         "SELECT id, filename, user_intent, summary, chunk_count, CAST(length(full_text) AS INTEGER) AS text_length, " +
                         "uploaded_at FROM documents ORDER BY uploaded_at DESC")) {
                while (rs.next()) {
                    result.add(new DocumentSummary(
                            rs.getString("id"),
                            rs.getString("filename"),
                            rs.getString("user_intent"),
                            rs.getString("summary"),
                            rs.getInt("chunk_count"),
                            rs.getInt("text_length"),
                            rs.getTimestamp("uploaded_at").toLocalDateTime()));
                }
            }
            return result;
        });
    }

    public void updateIntent(String documentId, String intent) {
        store.execute("aggiornamento intent " + documentId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("UPDATE documents SET user_intent = ? WHERE id = ?")) {
                ps.setString(1, intent);
                ps.setString(2, documentId);
                return ps.executeUpdate();
            }
        });
    }

    public void updateDigest(String documentId, DocumentDigest digest) {
        String arguments = toJson(digest.mainArguments() != null ? digest.mainArguments() : List.of());
        String concepts  = toJson(digest.keyConcepts() != null ? digest.keyConcepts() : List.of());
        store.execute("aggiornamento sintesi " + documentId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE documents SET summary = ?, main_arguments = ?, key_concepts = ? WHERE id = ?")) {
                setNullableString(ps, 1, digest.summary());
                ps.setString(2, arguments);
                ps.setString(3, concepts);
                ps.setString(4, documentId);
                return ps.executeUpdate();
            }
        });
    }

    /** Chunk del documento in ordine di testo; lista vuota se il documento non esiste. */
    public List<Chunk> findChunks(String documentId) {
        return store.execute("lettura chunk " + documentId, conn -> {
            List<Chunk> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT id, document_id, chunk_index, text, start_position, end_position, embedding " +
                    "FROM chunks WHERE document_id = ? ORDER BY chunk_index")) {
                ps.setString(1, documentId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String embedding = rs.getString("embedding");
                        result.add(new Chunk(
                                rs.getString("id"),
                                rs.getString("document_id"),
                                rs.getInt("chunk_index"),
                                rs.getString("text"),
                                rs.getInt("start_position"),
                                rs.getInt("end_position"),
                                embedding != null ? fromJson(embedding, float[].class) : null));
                    }
                }
            }
            return result;
        });
    }

    /**
     * Scrive l'embedding di un chunk. Idempotente: riscrivere lo stesso vettore non ha effetti.
     */
    public void updateChunkEmbedding(String chunkId, float[] embedding) {
        String json = toJson(embedding);
        store.execute("salvataggio embedding chunk " + chunkId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("UPDATE chunks SET embedding = ? WHERE id = ?")) {
                ps.setString(1, json);
                ps.setString(2, chunkId);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Rimuove il documento con chunk, annotazioni e collegamenti ai progetti.
     *
     * @return false se il documento non esiste
     */
    public boolean remove(String documentId) {
        return store.inTransaction("rimozione documento " + documentId, conn -> {
            int removed;
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM documents WHERE id = ?")) {
                ps.setString(1, documentId);
                removed = ps.executeUpdate();
            }
            if (removed == 0) return false;
            for (String table : List.of("chunks", "annotations", "project_documents")) {
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM " + table + " WHERE document_id = ?")) {
                    ps.setString(1, documentId);
                    ps.executeUpdate();
                }
            }
            return true;
        });
    }

    public int totalDocuments() {
        return count("SELECT COUNT(*) FROM documents");
    }

    public int totalChunks() {
        return count("SELECT COUNT(*) FROM chunks");
    }

    public int embeddedChunks() {
        return count("SELECT COUNT(*) FROM chunks WHERE embedding IS NOT NULL");
    }

    private int count(String sql) {
        return store.execute("conteggio", conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(sql)) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private DocumentRecord toRecord(ResultSet rs) throws SQLException {
        String arguments = rs.getString("main_arguments");
        String concepts  = rs.getString("key_concepts");
        return new DocumentRecord(
                rs.getString("id"),
                rs.getString("filename"),
                rs.getString("full_text"),
                rs.getString("user_intent"),
                rs.getString("summary"),
                arguments != null ? fromJson(arguments, STRING_LIST_TYPE) : List.of(),
                concepts != null ? fromJson(concepts, STRING_LIST_TYPE) : List.of(),
                rs.getInt("chunk_count"),
                rs.getTimestamp("uploaded_at").toLocalDateTime()
        );
    }

    static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value != null) ps.setString(index, value);
        else ps.setNull(index, Types.VARCHAR);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Errore serializzazione JSON", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Errore lettura JSON dal registry", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Errore lettura JSON dal registry", e);
        }
    }
}

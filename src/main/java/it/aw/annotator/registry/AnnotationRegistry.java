package it.aw.annotator.registry;

import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.AnnotationCategory;
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

import static it.aw.annotator.registry.DocumentRegistry.setNullableString;

/**
 * Annotazioni dei documenti, nella tabella {@code annotations}.
 */
@Component
public class AnnotationRegistry {

    static final String ANNOTATION_COLUMNS =
            "a.id, a.document_id, a.start_position, a.end_position, a.highlighted_text, a.category, a.note, " +
            "a.searchable_content, a.ai_generated, a.confidence_score, a.created_at";

    private final DuckDbStore store;

    public AnnotationRegistry(DuckDbStore store) {
        this.store = store;
    }

    public Annotation save(Annotation annotation) {
        return store.execute("salvataggio annotazione", conn -> {
            insert(conn.prepareStatement(
                    "INSERT INTO annotations (id, document_id, start_position, end_position, highlighted_text, " +
                    "category, note, searchable_content, ai_generated, confidence_score, created_at) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)"), annotation);
            return annotation;
        });
    }

    /** Salva più annotazioni in un'unica transazione. */
    public List<Annotation> saveAll(List<Annotation> annotations) {
        return store.inTransaction("salvataggio annotazioni", conn -> {
            for (Annotation annotation : annotations) {
                insert(conn.prepareStatement(
                        "INSERT INTO annotations (id, document_id, start_position, end_position, highlighted_text, " +
                        "category, note, searchable_content, ai_generated, confidence_score, created_at) " +
                        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)"), annotation);
            }
            return annotations;
        });
    }

    public Optional<Annotation> findById(String id) {
        return store.execute("lettura annotazione " + id, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + ANNOTATION_COLUMNS + " FROM annotations a WHERE a.id = ?")) {
                ps.setString(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) return Optional.of(toAnnotation(rs));
                }
            }
            return Optional.empty();
        });
    }

    /** Annotazioni del documento ordinate per posizione; vuota se il documento non esiste. */
    public List<Annotation> findByDocument(String documentId) {
        return store.execute("lettura annotazioni " + documentId, conn -> {
            List<Annotation> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + ANNOTATION_COLUMNS + " FROM annotations a WHERE a.document_id = ? " +
                    "ORDER BY a.start_position, a.created_at")) {
                ps.setString(1, documentId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) result.add(toAnnotation(rs));
                }
            }
            return result;
        });
    }

    public Optional<Annotation> update(String id, String note, AnnotationCategory category) {
        Optional<Annotation> existing = findById(id);
        if (existing.isEmpty()) return Optional.empty();
        store.execute("aggiornamento annotazione " + id, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE annotations SET note = ?, category = ? WHERE id = ?")) {
                ps.setString(1, note);
                ps.setString(2, category.wireName());
                ps.setString(3, id);
                return ps.executeUpdate();
            }
        });
        return Optional.of(existing.get().withNoteAndCategory(note, category));
    }

    public boolean delete(String id) {
        return store.execute("rimozione annotazione " + id, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM annotations WHERE id = ?")) {
                ps.setString(1, id);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /** Rimuove le annotazioni generate dalla pipeline, lasciando quelle dell'utente. */
    public int deleteAiGenerated(String documentId) {
        return store.execute("rimozione annotazioni generate " + documentId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "DELETE FROM annotations WHERE document_id = ? AND ai_generated")) {
                ps.setString(1, documentId);
                return ps.executeUpdate();
            }
        });
    }

    public int totalAnnotations() {
        return store.execute("conteggio annotazioni", conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM annotations")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private static void insert(PreparedStatement ps, Annotation a) throws SQLException {
        try (ps) {
            ps.setString(1, a.id());
            ps.setString(2, a.documentId());
            ps.setInt(3, a.startPosition());
            ps.setInt(4, a.endPosition());
            ps.setString(5, a.highlightedText());
            ps.setString(6, a.category().wireName());
            ps.setString(7, a.note());
            setNullableString(ps, 8, a.searchableContent());
            ps.setBoolean(9, a.aiGenerated());
            if (a.confidenceScore() != null) ps.setDouble(10, a.confidenceScore());
            else ps.setNull(10, Types.DOUBLE);
            ps.setTimestamp(11, Timestamp.valueOf(a.createdAt()));
            ps.executeUpdate();
        }
    }

    /** Mappa le colonne di {@link #ANNOTATION_COLUMNS}; usato anche dalle join di ProjectRegistry. */
    static Annotation toAnnotation(ResultSet rs) throws SQLException {
        double confidence = rs.getDouble("confidence_score");
        Double confidenceScore = rs.wasNull() ? null : confidence;
        return new Annotation(
                rs.getString("id"),
                rs.getString("document_id"),
                rs.getInt("start_position"),
                rs.getInt("end_position"),
                rs.getString("highlighted_text"),
                AnnotationCategory.fromWire(rs.getString("category")),
                rs.getString("note"),
                rs.getString("searchable_content"),
                rs.getBoolean("ai_generated"),
                confidenceScore,
                rs.getTimestamp("created_at").toLocalDateTime()
        );
    }
}

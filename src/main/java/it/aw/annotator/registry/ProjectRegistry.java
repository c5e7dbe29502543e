package it.aw.annotator.registry;

import it.aw.annotator.model.Folder;
import it.aw.annotator.model.LinkedAnnotation;
import it.aw.annotator.model.Project;
import it.aw.annotator.model.ProjectDocument;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static it.aw.annotator.registry.AnnotationRegistry.ANNOTATION_COLUMNS;
import static it.aw.annotator.registry.DocumentRegistry.setNullableString;

/**
 * Progetti, cartelle e collegamenti progetto-documento.
 * <p>
 * Le letture dei collegamenti fanno join con {@code documents} per portare
 * filename e summary, che la ricerca globale usa come testo indicizzabile.
 */
@Component
public class ProjectRegistry {

    private static final String LINK_SELECT =
            "SELECT pd.id AS link_id, pd.project_id, pd.document_id AS linked_document_id, pd.folder_id, " +
            "pd.retrieval_context, d.filename, d.summary " +
            "FROM project_documents pd JOIN documents d ON d.id = pd.document_id ";

    private final DuckDbStore store;

    public ProjectRegistry(DuckDbStore store) {
        this.store = store;
    }

    public Project saveProject(Project project) {
        return store.execute("salvataggio progetto", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO projects (id, name, thesis, context_summary, created_at) VALUES (?, ?, ?, ?, ?)")) {
                ps.setString(1, project.id());
                ps.setString(2, project.name());
                setNullableString(ps, 3, project.thesis());
                setNullableString(ps, 4, project.contextSummary());
                ps.setTimestamp(5, Timestamp.valueOf(project.createdAt()));
                ps.executeUpdate();
            }
            return project;
        });
    }

    public Optional<Project> findProject(String projectId) {
        return store.execute("lettura progetto " + projectId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT id, name, thesis, context_summary, created_at FROM projects WHERE id = ?")) {
                ps.setString(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(new Project(
                                rs.getString("id"),
                                rs.getString("name"),
                                rs.getString("thesis"),
                                rs.getString("context_summary"),
                                rs.getTimestamp("created_at").toLocalDateTime()));
                    }
                }
            }
            return Optional.empty();
        });
    }

    public Folder saveFolder(Folder folder) {
        return store.execute("salvataggio cartella", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO folders (id, project_id, name, description, context_summary) VALUES (?, ?, ?, ?, ?)")) {
                ps.setString(1, folder.id());
                ps.setString(2, folder.projectId());
                ps.setString(3, folder.name());
                setNullableString(ps, 4, folder.description());
                setNullableString(ps, 5, folder.contextSummary());
                ps.executeUpdate();
            }
            return folder;
        });
    }

    public List<Folder> findFolders(String projectId) {
        return store.execute("lettura cartelle " + projectId, conn -> {
            List<Folder> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT id, project_id, name, description, context_summary FROM folders " +
                    "WHERE project_id = ? ORDER BY name")) {
                ps.setString(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new Folder(
                                rs.getString("id"),
                                rs.getString("project_id"),
                                rs.getString("name"),
                                rs.getString("description"),
                                rs.getString("context_summary")));
                    }
                }
            }
            return result;
        });
    }

    /** Salva il collegamento; filename e summary del record vengono ignorati. */
    public void saveLink(ProjectDocument link) {
        store.execute("collegamento documento al progetto", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO project_documents (id, project_id, document_id, folder_id, retrieval_context) " +
                    "VALUES (?, ?, ?, ?, ?)")) {
                ps.setString(1, link.id());
                ps.setString(2, link.projectId());
                ps.setString(3, link.documentId());
                setNullableString(ps, 4, link.folderId());
                setNullableString(ps, 5, link.retrievalContext());
                return ps.executeUpdate();
            }
        });
    }

    public Optional<ProjectDocument> findLink(String projectDocumentId) {
        return store.execute("lettura documento di progetto " + projectDocumentId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(LINK_SELECT + "WHERE pd.id = ?")) {
                ps.setString(1, projectDocumentId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) return Optional.of(toLink(rs));
                }
            }
            return Optional.empty();
        });
    }

    public List<ProjectDocument> findLinks(String projectId) {
        return store.execute("lettura documenti del progetto " + projectId, conn -> {
            List<ProjectDocument> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    LINK_SELECT + "WHERE pd.project_id = ? ORDER BY d.filename, pd.id")) {
                ps.setString(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) result.add(toLink(rs));
                }
            }
            return result;
        });
    }

    /** Annotazioni di tutti i documenti collegati al progetto, con il relativo collegamento. */
    public List<LinkedAnnotation> findAnnotations(String projectId) {
        return store.execute("lettura annotazioni del progetto " + projectId, conn -> {
            List<LinkedAnnotation> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + ANNOTATION_COLUMNS + ", pd.id AS link_id, pd.project_id, " +
                    "pd.document_id AS linked_document_id, pd.folder_id, pd.retrieval_context, d.filename, d.summary " +
                    "FROM annotations a " +
                    "JOIN project_documents pd ON pd.document_id = a.document_id " +
                    "JOIN documents d ON d.id = pd.document_id " +
                    "WHERE pd.project_id = ? ORDER BY pd.id, a.start_position")) {
                ps.setString(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new LinkedAnnotation(toLink(rs), AnnotationRegistry.toAnnotation(rs)));
                    }
                }
            }
            return result;
        });
    }

    public int totalProjects() {
        return store.execute("conteggio progetti", conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM projects")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private static ProjectDocument toLink(ResultSet rs) throws SQLException {
        return new ProjectDocument(
                rs.getString("link_id"),
                rs.getString("project_id"),
                rs.getString("linked_document_id"),
                rs.getString("folder_id"),
                rs.getString("retrieval_context"),
                rs.getString("filename"),
                rs.getString("summary"));
    }
}

package it.aw.annotator.service;

import it.aw.annotator.exception.NotFoundException;
import it.aw.annotator.model.Folder;
import it.aw.annotator.model.Project;
import it.aw.annotator.model.ProjectDocument;
import it.aw.annotator.model.ProjectOverview;
import it.aw.annotator.registry.DocumentRegistry;
import it.aw.annotator.registry.ProjectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Progetti, cartelle e collegamento dei documenti caricati a un progetto.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRegistry projectRegistry;
    private final DocumentRegistry documentRegistry;

    public ProjectService(ProjectRegistry projectRegistry, DocumentRegistry documentRegistry) {
        this.projectRegistry = projectRegistry;
        this.documentRegistry = documentRegistry;
    }

    public Project createProject(String name, String thesis, String contextSummary) {
        requireText(name, "Il nome del progetto è obbligatorio");
        Project project = projectRegistry.saveProject(new Project(
                UUID.randomUUID().toString(), name, thesis, contextSummary, LocalDateTime.now()));
        log.info("Progetto creato: {} ({})", name, project.id());
        return project;
    }

    /** Progetto con cartelle e documenti collegati. */
    public ProjectOverview getProject(String projectId) {
        Project project = projectRegistry.findProject(projectId)
                .orElseThrow(() -> NotFoundException.project(projectId));
        return new ProjectOverview(project,
                projectRegistry.findFolders(projectId),
                projectRegistry.findLinks(projectId));
    }

    public Folder addFolder(String projectId, String name, String description, String contextSummary) {
        requireText(name, "Il nome della cartella è obbligatorio");
        requireProject(projectId);
        return projectRegistry.saveFolder(new Folder(
                UUID.randomUUID().toString(), projectId, name, description, contextSummary));
    }

    /**
     * Collega un documento al progetto, opzionalmente dentro una cartella del progetto stesso.
     */
    public ProjectDocument linkDocument(String projectId, String documentId, String folderId,
                                        String retrievalContext) {
        requireProject(projectId);
        if (!documentRegistry.exists(documentId)) {
            throw NotFoundException.document(documentId);
        }
        if (folderId != null && projectRegistry.findFolders(projectId).stream()
                .noneMatch(f -> f.id().equals(folderId))) {
            throw new IllegalArgumentException("La cartella " + folderId + " non appartiene al progetto " + projectId);
        }

        String linkId = UUID.randomUUID().toString();
        projectRegistry.saveLink(new ProjectDocument(linkId, projectId, documentId, folderId,
                retrievalContext, null, null));
        log.info("Documento {} collegato al progetto {} (link {})", documentId, projectId, linkId);
        return projectRegistry.findLink(linkId)
                .orElseThrow(() -> NotFoundException.projectDocument(linkId));
    }

    private void requireProject(String projectId) {
        if (projectRegistry.findProject(projectId).isEmpty()) {
            throw NotFoundException.project(projectId);
        }
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}

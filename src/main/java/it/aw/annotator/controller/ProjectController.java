package it.aw.annotator.controller;

import it.aw.annotator.controller.dto.FolderRequest;
import it.aw.annotator.controller.dto.GlobalSearchRequest;
import it.aw.annotator.controller.dto.LinkDocumentRequest;
import it.aw.annotator.controller.dto.ProjectRequest;
import it.aw.annotator.controller.dto.QueryRequest;
import it.aw.annotator.model.Folder;
import it.aw.annotator.model.GlobalSearchResponse;
import it.aw.annotator.model.Project;
import it.aw.annotator.model.ProjectDocument;
import it.aw.annotator.model.ProjectOverview;
import it.aw.annotator.model.SearchResult;
import it.aw.annotator.service.DocumentSearchService;
import it.aw.annotator.service.GlobalSearchService;
import it.aw.annotator.service.ProjectService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Progetti di ricerca e ricerca globale.
 *
 * Endpoint disponibili:
 *   POST /api/projects                         crea un progetto
 *   GET  /api/projects/{id}                    progetto con cartelle e documenti collegati
 *   POST /api/projects/{id}/folders            aggiunge una cartella
 *   POST /api/projects/{id}/documents          collega un documento caricato
 *   POST /api/projects/{id}/search             ricerca su contesti e annotazioni del progetto
 *   POST /api/project-documents/{id}/search    ricerca semantica su un documento del progetto
 */
@RestController
@RequestMapping("/api")
public class ProjectController {

    private final ProjectService projectService;
    private final GlobalSearchService globalSearchService;
    private final DocumentSearchService documentSearchService;

    public ProjectController(ProjectService projectService,
                             GlobalSearchService globalSearchService,
                             DocumentSearchService documentSearchService) {
        this.projectService = projectService;
        this.globalSearchService = globalSearchService;
        this.documentSearchService = documentSearchService;
    }

    @PostMapping("/projects")
    public ResponseEntity<Project> createProject(@RequestBody ProjectRequest request) {
        return ResponseEntity.ok(projectService.createProject(request.name(), request.thesis(), request.contextSummary()));
    }

    @GetMapping("/projects/{id}")
    public ResponseEntity<ProjectOverview> getProject(@PathVariable String id) {
        return ResponseEntity.ok(projectService.getProject(id));
    }

    @PostMapping("/projects/{id}/folders")
    public ResponseEntity<Folder> addFolder(@PathVariable String id, @RequestBody FolderRequest request) {
        return ResponseEntity.ok(projectService.addFolder(id, request.name(), request.description(),
                request.contextSummary()));
    }

    @PostMapping("/projects/{id}/documents")
    public ResponseEntity<ProjectDocument> linkDocument(@PathVariable String id,
                                                        @RequestBody LinkDocumentRequest request) {
        return ResponseEntity.ok(projectService.linkDocument(id, request.documentId(), request.folderId(),
                request.retrievalContext()));
    }

    // -------------------------------------------------------------------------
    // POST /api/projects/{id}/search
    // -------------------------------------------------------------------------

    /**
     * Un progetto inesistente restituisce una risposta vuota, non 404.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/projects/p1/search \
     *        -H "Content-Type: application/json" \
     *        -d '{"query": "lavoro remoto", "filters": {"categories": ["evidence"]}, "limit": 10}'
     */
    @PostMapping("/projects/{id}/search")
    public ResponseEntity<GlobalSearchResponse> search(@PathVariable String id,
                                                       @RequestBody GlobalSearchRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("La query è obbligatoria");
        }
        return ResponseEntity.ok(globalSearchService.search(id, request.query(), request.filters(), request.limit()));
    }

    @PostMapping("/project-documents/{id}/search")
    public ResponseEntity<List<SearchResult>> searchProjectDocument(@PathVariable String id,
                                                                    @RequestBody QueryRequest request) {
        return ResponseEntity.ok(documentSearchService.searchProjectDocument(id, request.query()));
    }
}

package it.aw.annotator.controller;

import it.aw.annotator.controller.dto.ErrorResponse;
import it.aw.annotator.controller.dto.IntentRequest;
import it.aw.annotator.controller.dto.QueryRequest;
import it.aw.annotator.exception.NotFoundException;
import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.ChunkingParams;
import it.aw.annotator.model.DocumentDigest;
import it.aw.annotator.model.DocumentRecord;
import it.aw.annotator.model.DocumentSummary;
import it.aw.annotator.model.SearchResult;
import it.aw.annotator.model.StoreStats;
import it.aw.annotator.registry.AnnotationRegistry;
import it.aw.annotator.registry.DocumentRegistry;
import it.aw.annotator.registry.ProjectRegistry;
import it.aw.annotator.service.DocumentSearchService;
import it.aw.annotator.service.IngestionService;
import it.aw.annotator.service.IntentAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * Caricamento, consultazione e analisi dei documenti.
 *
 * Endpoint disponibili:
 *   POST   /api/documents/upload           carica un PDF o TXT e lo divide in chunk
 *   GET    /api/documents                  lista dei documenti caricati
 *   GET    /api/documents/stats            statistiche aggregate dello store
 *   GET    /api/documents/{id}             documento completo, incluso il testo
 *   GET    /api/documents/{id}/summary     sintesi, argomenti principali, concetti chiave
 *   DELETE /api/documents/{id}             elimina documento, chunk, annotazioni e collegamenti
 *   POST   /api/documents/{id}/set-intent  imposta l'intent e rigenera le annotazioni automatiche
 *   POST   /api/documents/{id}/search      ricerca semantica di citazioni nel documento
 *
 * Nota: il path letterale /stats ha priorità su /{id} in Spring MVC.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

    private final IngestionService ingestionService;
    private final IntentAnalysisService intentAnalysisService;
    private final DocumentSearchService documentSearchService;
    private final DocumentRegistry registry;
    private final AnnotationRegistry annotationRegistry;
    private final ProjectRegistry projectRegistry;

    public DocumentController(IngestionService ingestionService,
                              IntentAnalysisService intentAnalysisService,
                              DocumentSearchService documentSearchService,
                              DocumentRegistry registry,
                              AnnotationRegistry annotationRegistry,
                              ProjectRegistry projectRegistry) {
        this.ingestionService = ingestionService;
        this.intentAnalysisService = intentAnalysisService;
        this.documentSearchService = documentSearchService;
        this.registry = registry;
        this.annotationRegistry = annotationRegistry;
        this.projectRegistry = projectRegistry;
    }

    // -------------------------------------------------------------------------
    // POST /api/documents/upload
    // -------------------------------------------------------------------------

    /**
     * Carica un documento (PDF o testo).
     * I parametri chunkSize e overlap sono opzionali: se omessi si usano i default (500/50).
     *
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/documents/upload?chunkSize=800&overlap=80" \
     *        -F "file=@articolo.pdf"
     */
    @PostMapping("/upload")
    public ResponseEntity<?> upload(
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "chunkSize", defaultValue = "" + ChunkingParams.DEFAULT_CHUNK_SIZE) int chunkSize,
            @RequestParam(value = "overlap",   defaultValue = "" + ChunkingParams.DEFAULT_OVERLAP)    int overlap)
            throws IOException {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(new ErrorResponse("Nessun file caricato"));
        }
        ChunkingParams params = new ChunkingParams(chunkSize, overlap);
        DocumentSummary summary = ingestionService.ingest(file, params);
        return ResponseEntity.ok(summary);
    }

    // -------------------------------------------------------------------------
    // GET /api/documents
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl http://localhost:8889/api/documents
     */
    @GetMapping
    public ResponseEntity<List<DocumentSummary>> listDocuments() {
        return ResponseEntity.ok(registry.findAllAsSummary());
    }

    // -------------------------------------------------------------------------
    // GET /api/documents/stats
    // -------------------------------------------------------------------------

    /**
     * Statistiche aggregate: documenti, chunk (e quanti già con embedding),
     * annotazioni, progetti.
     *
     * Esempio:
     *   curl http://localhost:8889/api/documents/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        StoreStats stats = new StoreStats(
                registry.totalDocuments(),
                registry.totalChunks(),
                registry.embeddedChunks(),
                annotationRegistry.totalAnnotations(),
                projectRegistry.totalProjects(),
                "DuckDB",
                "AllMiniLmL6V2Quantized"
        );
        return ResponseEntity.ok(stats);
    }

    // -------------------------------------------------------------------------
    // GET /api/documents/{id}
    // -------------------------------------------------------------------------

    @GetMapping("/{id}")
    public ResponseEntity<DocumentRecord> getDocument(@PathVariable String id) {
        return registry.findById(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> NotFoundException.document(id));
    }

    // -------------------------------------------------------------------------
    // GET /api/documents/{id}/summary
    // -------------------------------------------------------------------------

    /**
     * La sintesi viene generata in background dopo il caricamento:
     * finché non è pronta i campi sono null o vuoti.
     */
    @GetMapping("/{id}/summary")
    public ResponseEntity<DocumentDigest> getSummary(@PathVariable String id) {
        DocumentRecord doc = registry.findById(id).orElseThrow(() -> NotFoundException.document(id));
        return ResponseEntity.ok(new DocumentDigest(doc.summary(), doc.mainArguments(), doc.keyConcepts()));
    }

    // -------------------------------------------------------------------------
    // DELETE /api/documents/{id}
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -X DELETE http://localhost:8889/api/documents/3f2a...
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDocument(@PathVariable String id) {
        if (!registry.remove(id)) {
            throw NotFoundException.document(id);
        }
        log.info("Documento eliminato: {}", id);
        return ResponseEntity.noContent().build();
    }

    // -------------------------------------------------------------------------
    // POST /api/documents/{id}/set-intent
    // -------------------------------------------------------------------------

    /**
     * Imposta l'intent di ricerca e restituisce tutte le annotazioni del documento.
     * thoroughness: quick | standard | thorough | exhaustive (default standard).
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/documents/3f2a.../set-intent \
     *        -H "Content-Type: application/json" \
     *        -d '{"intent": "effetti del lavoro remoto sulla produttività", "thoroughness": "thorough"}'
     */
    @PostMapping("/{id}/set-intent")
    public ResponseEntity<List<Annotation>> setIntent(@PathVariable String id, @RequestBody IntentRequest request) {
        return ResponseEntity.ok(intentAnalysisService.setIntent(id, request.intent(), request.thoroughness()));
    }

    // -------------------------------------------------------------------------
    // POST /api/documents/{id}/search
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl -X POST http://localhost:8889/api/documents/3f2a.../search \
     *        -H "Content-Type: application/json" -d '{"query": "campione dello studio"}'
     */
    @PostMapping("/{id}/search")
    public ResponseEntity<List<SearchResult>> search(@PathVariable String id, @RequestBody QueryRequest request) {
        return ResponseEntity.ok(documentSearchService.searchDocument(id, request.query()));
    }
}

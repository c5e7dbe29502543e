package it.aw.annotator.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.AnnotationCategory;
import it.aw.annotator.model.Folder;
import it.aw.annotator.model.LinkedAnnotation;
import it.aw.annotator.model.Project;
import it.aw.annotator.model.ProjectDocument;
import it.aw.annotator.model.DocumentDigest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectRegistryTest {

    @TempDir
    Path tempDir;

    private DuckDbStore store;
    private ProjectRegistry registry;
    private DocumentRegistry documents;

    @BeforeEach
    void setUp() throws Exception {
        store = new DuckDbStore(tempDir.resolve("projects.duckdb").toString());
        store.init();
        registry = new ProjectRegistry(store);
        documents = new DocumentRegistry(store, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void storesProjectAndFolders() {
        registry.saveProject(new Project("p1", "Studio", "tesi", null, LocalDateTime.now()));
        registry.saveFolder(new Folder("f1", "p1", "Surveys", "questionari", null));
        registry.saveFolder(new Folder("f2", "other", "Altro", null, null));

        Project loaded = registry.findProject("p1").orElseThrow();
        assertEquals("tesi", loaded.thesis());
        assertNull(loaded.contextSummary());
        assertEquals(List.of("f1"), registry.findFolders("p1").stream().map(Folder::id).toList());
        assertEquals(1, registry.totalProjects());
        assertTrue(registry.findProject("missing").isEmpty());
    }

    @Test
    void linksCarryDocumentFilenameAndSummary() {
        documents.register(DocumentRegistryTest.document("d1"), List.of());
        documents.updateDigest("d1", new DocumentDigest("Sintesi del documento", List.of(), List.of()));
        registry.saveLink(new ProjectDocument("l1", "p1", "d1", "f1", "contesto", null, null));

        ProjectDocument link = registry.findLink("l1").orElseThrow();

        assertEquals("d1", link.documentId());
        assertEquals("f1", link.folderId());
        assertEquals("d1.txt", link.filename());
        assertEquals("Sintesi del documento", link.summary());
        assertEquals(List.of(link), registry.findLinks("p1"));
    }

    @Test
    void annotationsAreReachedThroughProjectLinks() {
        documents.register(DocumentRegistryTest.document("d1"), List.of());
        documents.register(DocumentRegistryTest.document("d2"), List.of());
        registry.saveLink(new ProjectDocument("l1", "p1", "d1", null, null, null, null));
        registry.saveLink(new ProjectDocument("l2", "p2", "d2", null, null, null, null));
        AnnotationRegistry annotations = new AnnotationRegistry(store);
        annotations.save(new Annotation("a1", "d1", 0, 6, "Remote", AnnotationCategory.EVIDENCE, "nota",
                "contenuto", false, null, LocalDateTime.now()));
        annotations.save(new Annotation("a2", "d2", 0, 6, "Remote", AnnotationCategory.EVIDENCE, "nota",
                null, false, null, LocalDateTime.now()));

        List<LinkedAnnotation> linked = registry.findAnnotations("p1");

        assertEquals(1, linked.size());
        assertEquals("l1", linked.get(0).link().id());
        assertEquals("d1.txt", linked.get(0).link().filename());
        assertEquals("a1", linked.get(0).annotation().id());
        assertEquals("contenuto", linked.get(0).annotation().searchableContent());
    }
}

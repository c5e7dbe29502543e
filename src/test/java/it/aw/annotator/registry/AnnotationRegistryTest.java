package it.aw.annotator.registry;

import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.AnnotationCategory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnnotationRegistryTest {

    @TempDir
    Path tempDir;

    private DuckDbStore store;
    private AnnotationRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        store = new DuckDbStore(tempDir.resolve("annotations.duckdb").toString());
        store.init();
        registry = new AnnotationRegistry(store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void findsAnnotationsOrderedByPosition() {
        registry.saveAll(List.of(
                annotation("late", 40, 50, false, null),
                annotation("early", 5, 10, true, 0.75)));

        List<Annotation> loaded = registry.findByDocument("doc");

        assertEquals(List.of("early", "late"), loaded.stream().map(Annotation::id).toList());
        assertEquals(0.75, loaded.get(0).confidenceScore());
        assertTrue(loaded.get(0).aiGenerated());
        assertNull(loaded.get(1).confidenceScore());
        assertEquals(2, registry.totalAnnotations());
    }

    @Test
    void updatesNoteAndCategory() {
        registry.save(annotation("a1", 0, 5, false, null));

        Annotation updated = registry.update("a1", "nuova nota", AnnotationCategory.METHODOLOGY).orElseThrow();

        assertEquals("nuova nota", updated.note());
        Annotation reloaded = registry.findById("a1").orElseThrow();
        assertEquals(AnnotationCategory.METHODOLOGY, reloaded.category());
        assertEquals("nuova nota", reloaded.note());
        assertTrue(registry.update("missing", "n", AnnotationCategory.EVIDENCE).isEmpty());
    }

    @Test
    void deletingGeneratedAnnotationsKeepsUserOnes() {
        registry.saveAll(List.of(
                annotation("user", 0, 5, false, null),
                annotation("ai-1", 10, 15, true, 0.9),
                annotation("ai-2", 20, 25, true, 0.4)));

        assertEquals(2, registry.deleteAiGenerated("doc"));
        assertEquals(List.of("user"), registry.findByDocument("doc").stream().map(Annotation::id).toList());
    }

    @Test
    void deleteReportsMissingAnnotations() {
        registry.save(annotation("a1", 0, 5, false, null));

        assertTrue(registry.delete("a1"));
        assertFalse(registry.delete("a1"));
    }

    private static Annotation annotation(String id, int start, int end, boolean ai, Double confidence) {
        return new Annotation(id, "doc", start, end, "testo", AnnotationCategory.EVIDENCE, "nota",
                null, ai, confidence, LocalDateTime.now());
    }
}

package it.aw.annotator.service;

import it.aw.annotator.exception.NotFoundException;
import it.aw.annotator.model.Annotation;
import it.aw.annotator.model.AnnotationCategory;
import it.aw.annotator.model.DocumentRecord;
import it.aw.annotator.registry.AnnotationRegistry;
import it.aw.annotator.registry.DocumentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AnnotationServiceTest {

    private static final String TEXT = "Remote work raised output.";

    @Mock
    private AnnotationRegistry annotationRegistry;

    @Mock
    private DocumentRegistry documentRegistry;

    private AnnotationService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new AnnotationService(annotationRegistry, documentRegistry);
        when(documentRegistry.findById("doc")).thenReturn(Optional.of(new DocumentRecord("doc", "doc.txt",
                TEXT, null, null, List.of(), List.of(), 1, LocalDateTime.now())));
    }

    @Test
    void createsManualAnnotation() {
        Annotation created = service.create("doc", 0, 11, "Remote work", AnnotationCategory.KEY_QUOTE,
                "tema centrale", null);

        ArgumentCaptor<Annotation> saved = ArgumentCaptor.forClass(Annotation.class);
        verify(annotationRegistry).save(saved.capture());
        assertSame(created, saved.getValue());
        assertFalse(created.aiGenerated());
        assertNull(created.confidenceScore());
        assertEquals(AnnotationCategory.KEY_QUOTE, created.category());
        assertEquals("Remote work", created.highlightedText());
    }

    @Test
    void missingHighlightIsTakenFromDocumentText() {
        Annotation created = service.create("doc", 12, 18, null, null, "nota", null);

        assertEquals("raised", created.highlightedText());
        assertEquals(AnnotationCategory.USER_ADDED, created.category());
    }

    @Test
    void spanOutsideTheTextIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.create("doc", 5, TEXT.length() + 1, "x", AnnotationCategory.EVIDENCE, "n", null));
        assertThrows(IllegalArgumentException.class,
                () -> service.create("doc", 5, 5, "x", AnnotationCategory.EVIDENCE, "n", null));
        assertThrows(IllegalArgumentException.class,
                () -> service.create("doc", -1, 4, "x", AnnotationCategory.EVIDENCE, "n", null));
        verify(annotationRegistry, never()).save(any());
    }

    @Test
    void createOnUnknownDocumentIsNotFound() {
        when(documentRegistry.findById("missing")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> service.create("missing", 0, 1, "R", AnnotationCategory.EVIDENCE, "n", null));
    }

    @Test
    void updateOfUnknownAnnotationIsNotFound() {
        when(annotationRegistry.findById("missing")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.update("missing", "nota", AnnotationCategory.ARGUMENT));
        verify(annotationRegistry, never()).update(anyString(), anyString(), any());
    }

    @Test
    void deleteOfUnknownAnnotationIsNotFound() {
        when(annotationRegistry.delete("missing")).thenReturn(false);

        assertThrows(NotFoundException.class, () -> service.delete("missing"));
    }

    @Test
    void listOfUnknownDocumentIsEmpty() {
        when(annotationRegistry.findByDocument("missing")).thenReturn(List.of());

        assertTrue(service.list("missing").isEmpty());
    }
}

package it.aw.annotator.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void relevanceTiersFollowScoreThresholds() {
        assertEquals(RelevanceLevel.HIGH, RelevanceLevel.fromScore(0.9));
        assertEquals(RelevanceLevel.HIGH, RelevanceLevel.fromScore(0.7));
        assertEquals(RelevanceLevel.MEDIUM, RelevanceLevel.fromScore(0.5));
        assertEquals(RelevanceLevel.LOW, RelevanceLevel.fromScore(0.49));
        assertEquals(RelevanceLevel.LOW, RelevanceLevel.fromWire("sconosciuto"));
    }

    @Test
    void categoriesUseSnakeCaseOnTheWire() throws Exception {
        assertEquals("\"key_quote\"", mapper.writeValueAsString(AnnotationCategory.KEY_QUOTE));
        assertEquals(AnnotationCategory.USER_ADDED, mapper.readValue("\"user_added\"", AnnotationCategory.class));
        assertThrows(IllegalArgumentException.class, () -> AnnotationCategory.fromWire("gossip"));
        assertThrows(IllegalArgumentException.class, () -> AnnotationCategory.fromWire(" "));
    }

    @Test
    void globalResultOmitsFieldsOfOtherVariants() throws Exception {
        Folder folder = new Folder("f1", "p1", "Surveys", null, "sintesi");

        JsonNode json = mapper.valueToTree(GlobalSearchResult.folderContext(folder, "sintesi", 0.9));

        assertEquals("folder_context", json.get("type").asText());
        assertEquals("high", json.get("relevanceLevel").asText());
        assertEquals("f1", json.get("folderId").asText());
        assertFalse(json.has("annotationId"));
        assertFalse(json.has("documentId"));
    }

    @Test
    void absentFiltersAdmitEverythingPresentOnesAreAllowLists() {
        SearchFilters none = SearchFilters.none();
        assertTrue(none.admitsCategory(AnnotationCategory.EVIDENCE));
        assertTrue(none.admitsFolder("f1"));

        SearchFilters empty = new SearchFilters(List.of(), List.of(), List.of());
        assertFalse(empty.admitsCategory(AnnotationCategory.EVIDENCE));
        assertFalse(empty.admitsFolder("f1"));
        assertFalse(empty.admitsDocument("l1"));
        assertTrue(empty.admitsDocumentFolder(null));
    }
}

package it.aw.annotator.model;

import java.util.List;

/**
 * Filtri opzionali della ricerca globale. Un filtro null non restringe nulla;
 * un filtro presente è una allow-list (anche se vuota). I filtri si combinano in AND.
 */
public record SearchFilters(
        List<AnnotationCategory> categories,
        List<String>             folderIds,
        List<String>             documentIds
) {

    public static SearchFilters none() {
        return new SearchFilters(null, null, null);
    }

    public boolean admitsCategory(AnnotationCategory category) {
        return categories == null || categories.contains(category);
    }

    public boolean admitsFolder(String folderId) {
        return folderIds == null || folderIds.contains(folderId);
    }

    /** Documenti fuori da ogni cartella passano sempre il filtro per cartella. */
    public boolean admitsDocumentFolder(String folderId) {
        return folderIds == null || folderId == null || folderIds.contains(folderId);
    }

    public boolean admitsDocument(String projectDocumentId) {
        return documentIds == null || documentIds.contains(projectDocumentId);
    }
}

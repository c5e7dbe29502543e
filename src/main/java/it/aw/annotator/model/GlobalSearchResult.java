package it.aw.annotator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Risultato della ricerca globale su un progetto.
 * <p>
 * I campi comuni sono sempre valorizzati; quelli specifici della variante
 * (cartella, documento, annotazione) sono null quando non pertinenti
 * e vengono omessi dal JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GlobalSearchResult(
        GlobalSearchResultType type,
        String             matchedText,
        double             similarityScore,   // [0, 1]
        RelevanceLevel     relevanceLevel,
        String             folderId,
        String             folderName,
        String             documentId,        // id del collegamento progetto-documento
        String             documentFilename,
        String             annotationId,
        String             highlightedText,
        String             note,
        AnnotationCategory category,
        Integer            startPosition
) {

    public static GlobalSearchResult projectContext(String matchedText, double score) {
        return new GlobalSearchResult(GlobalSearchResultType.FOLDER_CONTEXT, matchedText, score,
                RelevanceLevel.fromScore(score), null, null, null, null, null, null, null, null, null);
    }

    public static GlobalSearchResult folderContext(Folder folder, String matchedText, double score) {
        return new GlobalSearchResult(GlobalSearchResultType.FOLDER_CONTEXT, matchedText, score,
                RelevanceLevel.fromScore(score), folder.id(), folder.name(),
                null, null, null, null, null, null, null);
    }

    public static GlobalSearchResult documentContext(ProjectDocument link, String matchedText, double score) {
        return new GlobalSearchResult(GlobalSearchResultType.DOCUMENT_CONTEXT, matchedText, score,
                RelevanceLevel.fromScore(score), link.folderId(), null, link.id(), link.filename(),
                null, null, null, null, null);
    }

    public static GlobalSearchResult annotation(ProjectDocument link, Annotation annotation,
                                                String matchedText, double score) {
        return new GlobalSearchResult(GlobalSearchResultType.ANNOTATION, matchedText, score,
                RelevanceLevel.fromScore(score), link.folderId(), null, link.id(), link.filename(),
                annotation.id(), annotation.highlightedText(), annotation.note(),
                annotation.category(), annotation.startPosition());
    }
}

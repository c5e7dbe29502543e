package it.aw.annotator.service;

import it.aw.annotator.model.Folder;
import it.aw.annotator.model.GlobalSearchResponse;
import it.aw.annotator.model.GlobalSearchResult;
import it.aw.annotator.model.LinkedAnnotation;
import it.aw.annotator.model.Project;
import it.aw.annotator.model.ProjectDocument;
import it.aw.annotator.model.SearchFilters;
import it.aw.annotator.registry.ProjectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ricerca lessicale su un progetto.
 * <p>
 * Quattro sorgenti vengono valutate con {@link TextMatchScorer}:
 * <ol>
 *   <li>il contesto del progetto (contextSummary, tesi, nome)</li>
 *   <li>le cartelle (contextSummary, descrizione, nome), filtro per cartella</li>
 *   <li>i documenti collegati (retrievalContext, sintesi, filename), filtri per documento e cartella</li>
 *   <li>le annotazioni (searchableContent, testo evidenziato, nota), filtri per categoria, documento e cartella</li>
 * </ol>
 * Ogni elemento con punteggio positivo diventa un risultato. I risultati sono
 * ordinati per punteggio decrescente (ordinamento stabile) e troncati a {@code limit}
 * (default {@value #DEFAULT_LIMIT}, un valore non positivo viene rifiutato).
 * Un progetto inesistente restituisce una risposta vuota, non un errore.
 */
@Service
public class GlobalSearchService {

    private static final Logger log = LoggerFactory.getLogger(GlobalSearchService.class);

    public static final int DEFAULT_LIMIT = 20;

    private final ProjectRegistry projectRegistry;

    public GlobalSearchService(ProjectRegistry projectRegistry) {
        this.projectRegistry = projectRegistry;
    }

    public GlobalSearchResponse search(String projectId, String query, SearchFilters filters, Integer limit) {
        long started = System.currentTimeMillis();
        SearchFilters active = filters != null ? filters : SearchFilters.none();
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit deve essere positivo");
        }
        int max = limit != null ? limit : DEFAULT_LIMIT;

        Optional<Project> project = projectRegistry.findProject(projectId);
        if (project.isEmpty()) {
            log.debug("Ricerca globale su progetto inesistente {}", projectId);
            return GlobalSearchResponse.empty(System.currentTimeMillis() - started);
        }

        List<GlobalSearchResult> results = new ArrayList<>();
        for (SearchSource<?> source : sources(project.get(), active)) {
            scoreAndTag(source, query, results);
        }
        results.sort(Comparator.comparingDouble(GlobalSearchResult::similarityScore).reversed());

        int total = results.size();
        List<GlobalSearchResult> page = List.copyOf(results.subList(0, Math.min(max, total)));
        long elapsed = System.currentTimeMillis() - started;
        log.info("Ricerca globale '{}' su {}: {} risultati ({} restituiti) in {} ms",
                query, projectId, total, page.size(), elapsed);
        return new GlobalSearchResponse(page, total, elapsed);
    }

    private List<SearchSource<?>> sources(Project project, SearchFilters filters) {
        String projectId = project.id();
        return List.of(
                new SearchSource<Project>("progetto",
                        List.of(project),
                        p -> hasText(p.contextSummary()) || hasText(p.thesis()),
                        p -> Arrays.asList(p.contextSummary(), p.thesis(), p.name()),
                        (p, text, score) -> GlobalSearchResult.projectContext(text, score)),
                new SearchSource<Folder>("cartelle",
                        projectRegistry.findFolders(projectId),
                        f -> filters.admitsFolder(f.id()),
                        f -> Arrays.asList(f.contextSummary(), f.description(), f.name()),
                        GlobalSearchResult::folderContext),
                new SearchSource<ProjectDocument>("documenti",
                        projectRegistry.findLinks(projectId),
                        d -> filters.admitsDocument(d.id()) && filters.admitsDocumentFolder(d.folderId()),
                        d -> Arrays.asList(d.retrievalContext(), d.summary(), d.filename()),
                        GlobalSearchResult::documentContext),
                new SearchSource<LinkedAnnotation>("annotazioni",
                        projectRegistry.findAnnotations(projectId),
                        la -> filters.admitsCategory(la.annotation().category())
                                && filters.admitsDocument(la.link().id())
                                && filters.admitsDocumentFolder(la.link().folderId()),
                        la -> Arrays.asList(la.annotation().searchableContent(),
                                la.annotation().highlightedText(), la.annotation().note()),
                        (la, text, score) -> GlobalSearchResult.annotation(la.link(), la.annotation(), text, score)));
    }

    /** Valuta ogni elemento ammesso della sorgente e aggiunge i match a {@code results}. */
    static <T> void scoreAndTag(SearchSource<T> source, String query, List<GlobalSearchResult> results) {
        int hits = 0;
        for (T item : source.items()) {
            if (!source.admits().test(item)) continue;
            List<String> present = source.fields().apply(item).stream()
                    .filter(GlobalSearchService::hasText)
                    .toList();
            if (present.isEmpty()) continue;

            double score = TextMatchScorer.score(query, String.join(" ", present));
            if (score > 0) {
                results.add(source.toResult().create(item, present.get(0), score));
                hits++;
            }
        }
        log.debug("Ricerca globale, {}: {} match su {}", source.name(), hits, source.items().size());
    }

    private static boolean hasText(String value) {
        return Objects.nonNull(value) && !value.isBlank();
    }
}

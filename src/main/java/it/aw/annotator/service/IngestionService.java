package it.aw.annotator.service;

import it.aw.annotator.exception.IngestionRejectedException;
import it.aw.annotator.llm.DocumentSummarizer;
import it.aw.annotator.model.ChunkingParams;
import it.aw.annotator.model.DocumentRecord;
import it.aw.annotator.model.DocumentSummary;
import it.aw.annotator.model.TextChunk;
import it.aw.annotator.registry.DocumentRegistry;
import it.aw.annotator.service.TextExtractor.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Gestisce l'ingestione dei documenti.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Estrazione: PDF via PDFBox (spazi compressi), TXT normalizzato</li>
 *   <li>Controllo qualità: testo illeggibile o troppo corto viene rifiutato</li>
 *   <li>Chunking: {@link TextChunker} sul testo completo</li>
 *   <li>Salvataggio di documento e chunk (senza embedding)</li>
 *   <li>Sintesi in background: un errore viene solo registrato nel log</li>
 * </ol>
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    static final int MIN_TEXT_LENGTH = 10;

    static final String GARBLED_MESSAGE =
            "Il PDF sembra scansionato o usa font che non è possibile leggere. Prova a: "
            + "(1) usare un PDF con testo selezionabile, oppure "
            + "(2) copiare il testo in un file .txt e caricare quello.";

    private final DocumentRegistry registry;
    private final DocumentSummarizer summarizer;
    private final Executor executor;

    public IngestionService(DocumentRegistry registry,
                            DocumentSummarizer summarizer,
                            @Qualifier("applicationTaskExecutor") Executor executor) {
        this.registry = registry;
        this.summarizer = summarizer;
        this.executor = executor;
    }

    /**
     * Indicizza un nuovo documento.
     *
     * @throws IngestionRejectedException se il file non è PDF/TXT o non contiene testo utilizzabile
     */
    public DocumentSummary ingest(MultipartFile file, ChunkingParams params) throws IOException {
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "unknown";
        SourceType type = TextExtractor.detect(filename, file.getContentType())
                .orElseThrow(() -> new IngestionRejectedException("Sono ammessi solo file PDF e TXT"));

        String fullText;
        if (type == SourceType.PDF) {
            try (InputStream is = file.getInputStream()) {
                fullText = TextExtractor.extractPdf(is);
            }
            if (GarbledTextDetector.isGarbled(fullText)) {
                log.info("Ingestione rifiutata: testo illeggibile in {}", filename);
                throw new IngestionRejectedException(GARBLED_MESSAGE);
            }
        } else {
            fullText = TextExtractor.normalizeTxt(new String(file.getBytes(), StandardCharsets.UTF_8));
        }
        return ingestText(filename, fullText, params);
    }

    /** Indicizza testo già estratto. */
    public DocumentSummary ingestText(String filename, String fullText, ChunkingParams params) {
        if (fullText == null || fullText.length() < MIN_TEXT_LENGTH) {
            throw new IngestionRejectedException("Impossibile estrarre testo dal file");
        }
        String documentId = UUID.randomUUID().toString();
        log.info("Inizio ingestione: {} ({} caratteri) chunkSize={}, overlap={}, documentId={}",
                filename, fullText.length(), params.chunkSize(), params.overlap(), documentId);

        List<TextChunk> chunks = TextChunker.chunk(fullText, params);
        DocumentRecord record = new DocumentRecord(documentId, filename, fullText, null, null,
                List.of(), List.of(), chunks.size(), LocalDateTime.now());
        registry.register(record, chunks);

        log.info("Ingestione completata: {} ({} chunk, documentId={})", filename, chunks.size(), documentId);
        requestSummary(documentId, fullText);
        return record.toSummary();
    }

    private void requestSummary(String documentId, String fullText) {
        CompletableFuture
                .supplyAsync(() -> summarizer.summarize(fullText), executor)
                .thenAccept(digest -> {
                    registry.updateDigest(documentId, digest);
                    log.debug("Sintesi salvata per documentId={}", documentId);
                })
                .exceptionally(e -> {
                    log.warn("Sintesi non disponibile per documentId={}: {}", documentId, e.getMessage());
                    return null;
                });
    }
}

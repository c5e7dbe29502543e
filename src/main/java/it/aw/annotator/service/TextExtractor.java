package it.aw.annotator.service;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Estrazione e normalizzazione del testo dei file caricati (PDF via PDFBox, TXT).
 * <p>
 * Il testo restituito è quello che diventa il fullText del documento: tutti gli
 * offset successivi (chunk, annotazioni) si riferiscono a questa stringa.
 */
public final class TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TextExtractor.class);

    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SPACE_RUNS     = Pattern.compile(" +");

    public enum SourceType { PDF, TXT }

    private TextExtractor() {}

    /**
     * Riconosce il tipo dal content type o, in mancanza, dall'estensione.
     *
     * @return vuoto se il file non è né PDF né TXT
     */
    public static Optional<SourceType> detect(String filename, String contentType) {
        String name = filename != null ? filename.toLowerCase(Locale.ROOT) : "";
        if ("application/pdf".equals(contentType) || name.endsWith(".pdf")) {
            return Optional.of(SourceType.PDF);
        }
        if ("text/plain".equals(contentType) || name.endsWith(".txt")) {
            return Optional.of(SourceType.TXT);
        }
        return Optional.empty();
    }

    /**
     * Estrae il testo di tutte le pagine e comprime ogni sequenza di spazi bianchi
     * in un singolo spazio. L'input stream NON viene chiuso dal metodo.
     */
    public static String extractPdf(InputStream inputStream) throws IOException {
        try (PDDocument doc = PDDocument.load(inputStream)) {
            log.debug("TextExtractor: {} pagine trovate", doc.getNumberOfPages());
            String raw = new PDFTextStripper().getText(doc);
            return ANY_WHITESPACE.matcher(raw).replaceAll(" ").trim();
        }
    }

    /** Normalizza un file di testo: fine riga LF, tab come spazi, spazi multipli compressi. */
    public static String normalizeTxt(String content) {
        String text = content
                .replace("\r\n", "\n")
                .replace('\r', '\n')
                .replace('\t', ' ');
        return SPACE_RUNS.matcher(text).replaceAll(" ").trim();
    }
}

package it.aw.annotator.service;

import it.aw.annotator.model.ChunkingParams;
import it.aw.annotator.model.TextChunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Partiziona il testo di un documento in chunk sovrapposti, allineati quando
 * possibile a un confine di frase.
 * <p>
 * Il cursore avanza di {@code chunkSize - overlap} caratteri; la fine tentativa
 * di ogni chunk viene spostata sul terminatore di frase più vicino a
 * {@code chunkSize}, cercato in una finestra di ±50 caratteri. Non è un
 * tokenizzatore di frasi: riduce soltanto i tagli a metà frase, così le
 * citazioni estratte a valle restano integre.
 * <p>
 * Gli offset di ogni chunk sono relativi al testo originale passato in input.
 */
public final class TextChunker {

    private static final String[] SENTENCE_ENDERS = {". ", ".\n", "! ", "!\n", "? ", "?\n"};

    /** Caratteri oltre la fine tentativa inclusi nella finestra di ricerca. */
    private static final int LOOKAHEAD = 100;

    /** Distanza massima del terminatore dalla lunghezza obiettivo. */
    private static final int BOUNDARY_TOLERANCE = 50;

    private TextChunker() {}

    public static List<TextChunk> chunk(String text) {
        return chunk(text, ChunkingParams.defaults());
    }

    /**
     * Divide il testo in chunk ordinati per posizione crescente.
     * I chunk vuoti dopo il trim vengono scartati.
     *
     * @param text   testo completo del documento
     * @param params dimensione e overlap, già validati da {@link ChunkingParams}
     * @return lista di chunk, vuota per testo nullo o vuoto
     */
    public static List<TextChunk> chunk(String text, ChunkingParams params) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }
        int length    = text.length();
        int chunkSize = params.chunkSize();
        int overlap   = params.overlap();

        int start = 0;
        while (start < length) {
            int end = start + chunkSize;
            if (end < length) {
                String window = text.substring(start, Math.min(end + LOOKAHEAD, length));
                int boundary = findSentenceEnd(window, chunkSize);
                if (boundary > 0) {
                    end = start + boundary;
                }
            } else {
                end = length;
            }

            String slice = text.substring(start, end);
            if (!slice.isBlank()) {
                chunks.add(new TextChunk(slice, start, end));
            }

            int next = end - overlap;
            if (next >= length - overlap) {
                break;
            }
            // un confine di frase molto anticipato non deve far arretrare il cursore
            start = Math.max(next, start + 1);
        }
        return chunks;
    }

    /**
     * Cerca nella finestra il terminatore di frase la cui fine è più vicina a
     * {@code targetLength}, considerando solo terminatori che iniziano entro
     * {@code targetLength ± BOUNDARY_TOLERANCE}. A parità di distanza vince il primo.
     *
     * @return posizione subito dopo il terminatore, oppure -1 se non trovato
     */
    static int findSentenceEnd(String window, int targetLength) {
        int best = -1;
        int bestDistance = Integer.MAX_VALUE;
        int from = Math.max(0, targetLength - BOUNDARY_TOLERANCE);
        int to   = targetLength + BOUNDARY_TOLERANCE;

        for (String ender : SENTENCE_ENDERS) {
            int pos = window.indexOf(ender, from);
            while (pos != -1 && pos <= to) {
                int candidate = pos + ender.length();
                int distance = Math.abs(candidate - targetLength);
                if (distance < bestDistance || (distance == bestDistance && candidate < best)) {
                    best = candidate;
                    bestDistance = distance;
                }
                pos = window.indexOf(ender, pos + 1);
            }
        }
        return best;
    }
}

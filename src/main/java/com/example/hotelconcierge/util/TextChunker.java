package com.example.hotelconcierge.util;

import com.example.hotelconcierge.model.rag.ChunkDraft;
import com.example.hotelconcierge.model.rag.PageBoundary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Trocea texto por palabras con solape, asignando a cada trozo su pagina de origen.
 *
 * <p>El tamaño se mide en caracteres (cada palabra cuenta su longitud + 1 separador).
 * El solape se aproxima en palabras: {@code overlap / 10}.
 */
public class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_OVERLAP = 200;

    // Incluye espacios Unicode (U+00A0 y similares) que PDFBox suele dejar
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextChunker() {
    }

    public static List<ChunkDraft> chunk(String text, List<PageBoundary> pages) {
        return chunk(text, pages, DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    public static List<ChunkDraft> chunk(String text, List<PageBoundary> pages, int chunkSize, int overlap) {
        String source = text == null ? "" : text;
        List<ChunkDraft> out = new ArrayList<>();
        String[] words = Arrays.stream(WHITESPACE.split(source))
                .filter(w -> !w.isEmpty())
                .toArray(String[]::new);
        if (words.length == 0 || chunkSize <= 0) {
            // Nada que trocear con texto vacio o tamaño invalido.
            return out;
        }

        int overlapWords = Math.max(0, overlap) / 10;
        List<PageBoundary> pageTable = pages == null ? List.of() : pages;

        List<String> current = new ArrayList<>();
        int currentLength = 0;

        for (String word : words) {
            if (currentLength + word.length() + 1 > chunkSize && !current.isEmpty()) {
                out.add(draft(out.size(), current, source, pageTable));

                List<String> next = new ArrayList<>();
                if (current.size() > overlapWords) {
                    next.addAll(current.subList(current.size() - overlapWords, current.size()));
                }
                next.add(word);
                current = next;
                currentLength = measure(current);
            } else {
                current.add(word);
                currentLength += word.length() + 1;
            }
        }

        // El resto siempre forma el ultimo trozo, aunque sea pequeño.
        if (!current.isEmpty()) {
            out.add(draft(out.size(), current, source, pageTable));
        }
        return out;
    }

    /**
     * Pagina que contiene el offset; 1 si ninguna lo contiene.
     */
    public static int resolvePage(int offset, List<PageBoundary> pages) {
        if (offset < 0 || pages == null) {
            return 1;
        }
        for (PageBoundary page : pages) {
            if (page.contains(offset)) {
                return page.pageNumber();
            }
        }
        return 1;
    }

    private static ChunkDraft draft(int index, List<String> words, String source, List<PageBoundary> pages) {
        String content = String.join(" ", words);
        // Primera aparicion: si el mismo texto se repite antes, el span apunta ahi.
        int start = source.indexOf(content);
        int end = start < 0 ? ChunkDraft.UNLOCATED : start + content.length();
        return new ChunkDraft(index, content, start, end, resolvePage(start, pages));
    }

    private static int measure(List<String> words) {
        int total = 0;
        for (String w : words) {
            total += w.length() + 1;
        }
        return total;
    }
}

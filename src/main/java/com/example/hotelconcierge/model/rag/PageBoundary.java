package com.example.hotelconcierge.model.rag;

/**
 * Rango de caracteres de una pagina dentro del texto extraido.
 * Ambos extremos son inclusivos.
 */
public record PageBoundary(int pageNumber, int charStart, int charEnd) {

    public boolean contains(int offset) {
        return offset >= charStart && offset <= charEnd;
    }
}

package com.example.hotelconcierge.model.rag;

/**
 * Resultado de (re)indexar un documento.
 */
public record IndexingSummary(Long documentId, int pages, int chunks, int embeddedChunks) {
}

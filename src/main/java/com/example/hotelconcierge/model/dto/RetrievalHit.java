package com.example.hotelconcierge.model.dto;

/**
 * Resultado de busqueda: chunk, resumen de su documento, score y texto completo.
 */
public record RetrievalHit(ChunkView chunk, DocumentSummary document, double score, String content) {
}

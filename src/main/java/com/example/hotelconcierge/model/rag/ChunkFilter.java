package com.example.hotelconcierge.model.rag;

/**
 * Restricciones previas al ranking. {@code category} null = todas.
 */
public record ChunkFilter(String category, boolean activeOnly, boolean withEmbeddingOnly) {

    public static ChunkFilter activeIn(String category) {
        return new ChunkFilter(blankToNull(category), true, false);
    }

    public ChunkFilter embeddedOnly() {
        return new ChunkFilter(category, activeOnly, true);
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}

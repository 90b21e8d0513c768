package com.example.hotelconcierge.model.rag;

/**
 * Trozo calculado por el chunker, todavia sin persistir.
 *
 * <p>{@code startChar}/{@code endChar} valen -1 cuando el texto del trozo no aparece tal cual
 * en el documento. {@code embedding} es null si no hay vector.
 */
public record ChunkDraft(int index,
                         String content,
                         int startChar,
                         int endChar,
                         int pageNumber,
                         double[] embedding) {

    public static final int UNLOCATED = -1;

    public ChunkDraft(int index, String content, int startChar, int endChar, int pageNumber) {
        this(index, content, startChar, endChar, pageNumber, null);
    }

    public ChunkDraft withEmbedding(double[] vector) {
        return new ChunkDraft(index, content, startChar, endChar, pageNumber, vector);
    }

    public boolean located() {
        return startChar != UNLOCATED;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}

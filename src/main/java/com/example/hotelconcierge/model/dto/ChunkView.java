package com.example.hotelconcierge.model.dto;

import com.example.hotelconcierge.model.entity.DocumentChunk;

import java.time.Instant;

public record ChunkView(
        Long id,
        Long documentId,
        int chunkIndex,
        String preview,
        Integer pageNumber,
        Integer startChar,
        Integer endChar,
        Instant createdAt
) {
    private static final int PREVIEW_LENGTH = 200;

    public static ChunkView of(DocumentChunk c) {
        String text = c.getContent() == null ? "" : c.getContent();
        String preview = text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
        return new ChunkView(
                c.getId(),
                c.getDocument() == null ? null : c.getDocument().getId(),
                c.getChunkIndex(),
                preview,
                c.getPageNumber(),
                c.getStartChar(),
                c.getEndChar(),
                c.getCreatedAt()
        );
    }
}

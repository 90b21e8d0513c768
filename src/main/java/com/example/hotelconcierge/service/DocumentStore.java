package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.entity.DocumentChunk;
import com.example.hotelconcierge.model.entity.HotelDocument;
import com.example.hotelconcierge.model.rag.ChunkDraft;
import com.example.hotelconcierge.model.rag.ChunkFilter;

import java.util.List;
import java.util.Optional;

/**
 * Acceso a documentos y chunks. El nucleo de recuperacion solo lee y escribe chunks derivados.
 */
public interface DocumentStore {

    Optional<HotelDocument> loadDocument(Long id);

    /**
     * Sustituye los chunks del documento por los indicados.
     */
    List<DocumentChunk> saveChunks(Long documentId, List<ChunkDraft> chunks);

    /**
     * Chunks que cumplen el filtro, ordenados por documento y posicion.
     */
    List<DocumentChunk> queryChunks(ChunkFilter filter);
}

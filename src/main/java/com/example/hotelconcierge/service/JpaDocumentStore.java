package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.entity.DocumentChunk;
import com.example.hotelconcierge.model.entity.HotelDocument;
import com.example.hotelconcierge.model.rag.ChunkDraft;
import com.example.hotelconcierge.model.rag.ChunkFilter;
import com.example.hotelconcierge.repository.DocumentChunkRepository;
import com.example.hotelconcierge.repository.HotelDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Component
public class JpaDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(JpaDocumentStore.class);

    private final HotelDocumentRepository docRepo;
    private final DocumentChunkRepository chunkRepo;

    public JpaDocumentStore(HotelDocumentRepository docRepo, DocumentChunkRepository chunkRepo) {
        this.docRepo = docRepo;
        this.chunkRepo = chunkRepo;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<HotelDocument> loadDocument(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return docRepo.findById(id);
    }

    @Override
    @Transactional
    public List<DocumentChunk> saveChunks(Long documentId, List<ChunkDraft> chunks) {
        HotelDocument doc = docRepo.findById(documentId)
                .orElseThrow(() -> new NoSuchElementException("Documento no encontrado: " + documentId));

        int replaced = chunkRepo.deleteByDocumentId(documentId);

        List<DocumentChunk> toPersist = new ArrayList<>(chunks.size());
        for (ChunkDraft draft : chunks) {
            DocumentChunk chunk = new DocumentChunk();
            chunk.setDocument(doc);
            chunk.setChunkIndex(draft.index());
            chunk.setContent(draft.content());
            chunk.setPageNumber(draft.pageNumber());
            chunk.setStartChar(draft.startChar());
            chunk.setEndChar(draft.endChar());
            chunk.setEmbedding(draft.hasEmbedding() ? draft.embedding() : null);
            toPersist.add(chunk);
        }

        List<DocumentChunk> persisted = chunkRepo.saveAll(toPersist);
        log.debug("Chunks guardados documentId={} chunks={} replaced={}", documentId, persisted.size(), replaced);
        return persisted;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentChunk> queryChunks(ChunkFilter filter) {
        ChunkFilter f = filter == null ? ChunkFilter.activeIn(null) : filter;
        return chunkRepo.findForRetrieval(f.category(), f.activeOnly(), f.withEmbeddingOnly());
    }
}

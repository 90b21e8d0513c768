package com.example.hotelconcierge.repository;

import com.example.hotelconcierge.model.entity.DocumentChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, Long> {

    // Orden estable: documento y posicion dentro del documento
    @Query("""
        select c
        from DocumentChunk c
        join fetch c.document d
        where (:category is null or d.category = :category)
          and (:activeOnly = false or d.active = true)
          and (:withEmbeddingOnly = false or c.embedding is not null)
        order by d.id asc, c.chunkIndex asc
    """)
    List<DocumentChunk> findForRetrieval(@Param("category") String category,
                                         @Param("activeOnly") boolean activeOnly,
                                         @Param("withEmbeddingOnly") boolean withEmbeddingOnly);

    List<DocumentChunk> findByDocument_IdOrderByChunkIndexAsc(Long documentId);

    long countByDocument_Id(Long documentId);

    @Modifying
    @Query("delete from DocumentChunk c where c.document.id = :docId")
    int deleteByDocumentId(@Param("docId") Long docId);
}

package com.example.hotelconcierge.model.entity;

import com.example.hotelconcierge.model.converter.EmbeddingJsonConverter;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
        name = "document_chunk",
        indexes = {
                @Index(name = "idx_document_chunk_document", columnList = "document_id, chunkIndex")
        }
)
public class DocumentChunk {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", nullable = false)
    private HotelDocument document;

    @Column(nullable = false)
    private int chunkIndex;

    @Lob
    @Column(nullable = false)
    private String content;

    private Integer pageNumber;

    private Integer startChar;

    private Integer endChar;

    // Embedding como JSON; null cuando no hubo modelo disponible
    @Lob
    @Convert(converter = EmbeddingJsonConverter.class)
    @Column(name = "embedding_json")
    private double[] embedding;

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public HotelDocument getDocument() { return document; }
    public void setDocument(HotelDocument document) { this.document = document; }

    public int getChunkIndex() { return chunkIndex; }
    public void setChunkIndex(int chunkIndex) { this.chunkIndex = chunkIndex; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public Integer getPageNumber() { return pageNumber; }
    public void setPageNumber(Integer pageNumber) { this.pageNumber = pageNumber; }

    public Integer getStartChar() { return startChar; }
    public void setStartChar(Integer startChar) { this.startChar = startChar; }

    public Integer getEndChar() { return endChar; }
    public void setEndChar(Integer endChar) { this.endChar = endChar; }

    public double[] getEmbedding() { return embedding; }
    public void setEmbedding(double[] embedding) { this.embedding = embedding; }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public Instant getCreatedAt() { return createdAt; }
}

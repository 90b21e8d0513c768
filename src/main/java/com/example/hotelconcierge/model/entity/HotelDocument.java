package com.example.hotelconcierge.model.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
        name = "hotel_document",
        indexes = {
                @Index(name = "idx_hotel_document_category", columnList = "category")
        }
)
public class HotelDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String filename;

    @Column(nullable = false, length = 255)
    private String originalFilename;

    @Column(nullable = false, length = 500)
    private String filePath;

    private Long fileSize;

    @Column(length = 100)
    private String mimeType;

    // policy, menu, amenities, procedures...
    @Column(length = 50)
    private String category;

    @Column(length = 255)
    private String title;

    @Lob
    private String description;

    // Texto extraido del fichero
    @Lob
    private String contentText;

    @Column(nullable = false)
    private boolean indexed = false;

    @Column(nullable = false)
    private boolean active = true;

    @Column(length = 100)
    private String uploadedBy;

    @Column(nullable = false)
    private Instant uploadDate = Instant.now();

    @Column(nullable = false)
    private Instant lastUpdated = Instant.now();

    @OneToMany(mappedBy = "document", cascade = CascadeType.REMOVE, orphanRemoval = true)
    @OrderBy("chunkIndex ASC")
    private List<DocumentChunk> chunks = new ArrayList<>();

    @PreUpdate
    public void onUpdate() {
        this.lastUpdated = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }

    public String getOriginalFilename() { return originalFilename; }
    public void setOriginalFilename(String originalFilename) { this.originalFilename = originalFilename; }

    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }

    public Long getFileSize() { return fileSize; }
    public void setFileSize(Long fileSize) { this.fileSize = fileSize; }

    public String getMimeType() { return mimeType; }
    public void setMimeType(String mimeType) { this.mimeType = mimeType; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getContentText() { return contentText; }
    public void setContentText(String contentText) { this.contentText = contentText; }

    public boolean isIndexed() { return indexed; }
    public void setIndexed(boolean indexed) { this.indexed = indexed; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public String getUploadedBy() { return uploadedBy; }
    public void setUploadedBy(String uploadedBy) { this.uploadedBy = uploadedBy; }

    public Instant getUploadDate() { return uploadDate; }
    public Instant getLastUpdated() { return lastUpdated; }

    public List<DocumentChunk> getChunks() { return chunks; }
}

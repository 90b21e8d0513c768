package com.example.hotelconcierge.model.dto;

import com.example.hotelconcierge.model.entity.HotelDocument;

import java.time.Instant;

public record DocumentSummary(
        Long id,
        String title,
        String originalFilename,
        String category,
        String mimeType,
        Long fileSize,
        String description,
        boolean indexed,
        boolean active,
        String uploadedBy,
        Instant uploadDate,
        Instant lastUpdated
) {
    public static DocumentSummary of(HotelDocument d) {
        return new DocumentSummary(
                d.getId(),
                d.getTitle(),
                d.getOriginalFilename(),
                d.getCategory(),
                d.getMimeType(),
                d.getFileSize(),
                d.getDescription(),
                d.isIndexed(),
                d.isActive(),
                d.getUploadedBy(),
                d.getUploadDate(),
                d.getLastUpdated()
        );
    }
}

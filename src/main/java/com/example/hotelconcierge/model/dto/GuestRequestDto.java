package com.example.hotelconcierge.model.dto;

import com.example.hotelconcierge.model.entity.GuestRequest;

import java.time.Instant;

public record GuestRequestDto(
        String id,
        String conversationId,
        String userId,
        String type,
        String title,
        String description,
        String priority,
        String status,
        String roomNumber,
        String assignedTo,
        String notes,
        Instant completedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static GuestRequestDto of(GuestRequest r) {
        return new GuestRequestDto(
                r.getId(),
                r.getConversationId(),
                r.getUserId(),
                r.getType() == null ? null : r.getType().wireName(),
                r.getTitle(),
                r.getDescription(),
                r.getPriority() == null ? null : r.getPriority().wireName(),
                r.getStatus() == null ? null : r.getStatus().wireName(),
                r.getRoomNumber(),
                r.getAssignedTo(),
                r.getNotes(),
                r.getCompletedAt(),
                r.getCreatedAt(),
                r.getUpdatedAt()
        );
    }
}

package com.example.hotelconcierge.model.dto;

import com.example.hotelconcierge.model.entity.Conversation;

import java.time.Instant;

public record ConversationDto(
        String id,
        String userId,
        String channel,
        String status,
        String priority,
        String category,
        String sentiment,
        Integer satisfactionScore,
        String agentId,
        Instant createdAt,
        Instant updatedAt,
        Instant resolvedAt,
        long messageCount
) {
    public static ConversationDto of(Conversation c, long messageCount) {
        return new ConversationDto(
                c.getId(),
                c.getUserId(),
                c.getChannel(),
                c.getStatus() == null ? null : c.getStatus().wireName(),
                c.getPriority() == null ? null : c.getPriority().wireName(),
                c.getCategory(),
                c.getSentiment(),
                c.getSatisfactionScore(),
                c.getAgentId(),
                c.getCreatedAt(),
                c.getUpdatedAt(),
                c.getResolvedAt(),
                messageCount
        );
    }
}

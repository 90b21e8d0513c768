package com.example.hotelconcierge.model.dto;

import com.example.hotelconcierge.model.entity.ConversationMessage;

import java.time.Instant;
import java.util.Locale;

public record ConversationMessageDto(
        Long id,
        String conversationId,
        String senderType,
        String content,
        String intent,
        Double confidence,
        Double processingTimeSeconds,
        Instant createdAt
) {
    public static ConversationMessageDto of(ConversationMessage m, String conversationId) {
        return new ConversationMessageDto(
                m.getId(),
                conversationId,
                m.getSender() == null ? null : m.getSender().name().toLowerCase(Locale.ROOT),
                m.getContent(),
                m.getIntent(),
                m.getConfidence(),
                m.getProcessingTimeSeconds(),
                m.getCreatedAt()
        );
    }
}

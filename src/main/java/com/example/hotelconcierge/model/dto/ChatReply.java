package com.example.hotelconcierge.model.dto;

import java.util.List;

public record ChatReply(
        String conversationId,
        String response,
        String intent,
        double confidence,
        String sentiment,
        boolean escalate,
        String requestId,
        double processingTimeSeconds,
        List<String> suggestedResponses
) {
}

package com.example.hotelconcierge.model.dto;

import java.util.List;

public record ConversationPage(
        List<ConversationDto> conversations,
        long total,
        int pages,
        int currentPage
) {
}

package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.analysis.HistoryEntry;

import java.util.List;

public interface ConversationHistory {

    /**
     * Ultimos {@code limit} mensajes, del mas antiguo al mas reciente.
     */
    List<HistoryEntry> recentMessages(String conversationId, int limit);
}

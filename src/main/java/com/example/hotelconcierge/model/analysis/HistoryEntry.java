package com.example.hotelconcierge.model.analysis;

/**
 * Mensaje previo de la conversacion. role = "user" | "assistant".
 */
public record HistoryEntry(String role, String content) {
}

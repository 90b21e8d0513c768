package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.analysis.Intent;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Respuestas rapidas sugeridas al personal segun la intencion detectada.
 */
@Component
public class SuggestedResponses {

    static final List<String> DEFAULT = List.of("How can I help you today?");

    private static final Map<Intent, List<String>> BY_INTENT = new EnumMap<>(Map.of(
            Intent.BOOKING, List.of(
                    "I'd be happy to help you with your reservation. What dates are you looking for?",
                    "Let me check our availability for you.",
                    "Would you like to modify an existing reservation?"),
            Intent.COMPLAINT, List.of(
                    "I sincerely apologize for the inconvenience. Let me help resolve this immediately.",
                    "I understand your concern. Can you provide more details so I can assist you better?",
                    "I'd like to escalate this to our manager for immediate attention."),
            Intent.INQUIRY, List.of(
                    "I'm here to help! What would you like to know?",
                    "I can provide information about our services and amenities.",
                    "How can I assist you today?"),
            Intent.SERVICE_REQUEST, List.of(
                    "I'll arrange that service for you right away.",
                    "Let me connect you with the appropriate department.",
                    "What room number should I send the service to?")
    ));

    /**
     * Igual que {@link #forIntent(Intent)} pero a partir del nombre en la API; "error" o
     * nombres desconocidos dan la respuesta por defecto.
     */
    public List<String> forWireName(String intent) {
        for (Intent candidate : Intent.values()) {
            if (candidate.wireName().equals(intent)) {
                return forIntent(candidate);
            }
        }
        return DEFAULT;
    }

    public List<String> forIntent(Intent intent) {
        if (intent == null) {
            return DEFAULT;
        }
        return BY_INTENT.getOrDefault(intent, DEFAULT);
    }
}

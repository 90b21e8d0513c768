package com.example.hotelconcierge.model.dto;

import java.util.List;

/**
 * Resultado completo de procesar un mensaje de huesped. Siempre bien formado, tambien en error.
 */
public record ConciergeReply(
        String response,
        String intent,
        double confidence,
        String sentiment,
        double processingTimeSeconds,
        boolean escalate,
        List<String> escalationTriggers,
        String requestId,
        String error
) {
    public static final String ERROR_INTENT = "error";
    public static final String APOLOGY = "I apologize, but I'm experiencing technical difficulties. "
            + "Please contact our front desk for immediate assistance.";

    public static ConciergeReply failure(String error, double processingTimeSeconds) {
        return new ConciergeReply(APOLOGY, ERROR_INTENT, 0.0, "neutral", processingTimeSeconds, true,
                List.of(), null, error);
    }
}

package com.example.hotelconcierge.model.analysis;

import java.util.List;

/**
 * Taxonomia fija de intenciones. El orden de declaracion decide los empates.
 */
public enum Intent {
    BOOKING("booking", List.of("book", "reserve", "reservation", "availability", "room")),
    COMPLAINT("complaint", List.of("complain", "problem", "issue", "wrong", "bad", "terrible")),
    INQUIRY("inquiry", List.of("information", "help", "question", "what", "how", "when")),
    SERVICE_REQUEST("service_request", List.of("service", "housekeeping", "maintenance", "room service")),
    CHECKOUT("checkout", List.of("checkout", "check out", "leaving", "bill", "payment")),
    AMENITIES("amenities", List.of("pool", "gym", "spa", "restaurant", "wifi", "parking")),
    EMERGENCY("emergency", List.of("emergency", "urgent", "help", "fire", "medical")),
    POLICY_INQUIRY("policy_inquiry", List.of("policy", "rule", "regulation", "allowed", "permitted", "procedure")),
    CONCIERGE_REQUEST("concierge_request", List.of("recommend", "suggest", "where", "restaurant", "attraction", "tour")),
    GUEST_REQUEST("guest_request", List.of("need", "want", "request", "arrange", "schedule", "order"));

    private final String wireName;
    private final List<String> keywords;

    Intent(String wireName, List<String> keywords) {
        this.wireName = wireName;
        this.keywords = keywords;
    }

    public String wireName() {
        return wireName;
    }

    public List<String> keywords() {
        return keywords;
    }

    public static Intent fromWireName(String value) {
        for (Intent intent : values()) {
            if (intent.wireName.equalsIgnoreCase(value)) {
                return intent;
            }
        }
        throw new IllegalArgumentException("Intencion desconocida: " + value);
    }
}

package com.example.hotelconcierge.model.analysis;

public enum EscalationTrigger {
    EMERGENCY_INTENT,
    NEGATIVE_WITH_SEVERITY_WORD,
    HUMAN_OR_AGENT_REQUESTED,
    SPEAK_TO_SOMEONE
}

package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.analysis.EscalationTrigger;
import com.example.hotelconcierge.model.analysis.EscalationVerdict;
import com.example.hotelconcierge.model.analysis.Intent;
import com.example.hotelconcierge.model.analysis.Sentiment;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decide si la conversacion pasa a personal humano. OR de triggers independientes, sin pesos.
 */
@Component
public class EscalationPolicy {

    static final List<String> SEVERITY_WORDS = List.of("manager", "supervisor", "complaint", "refund");
    static final List<String> HANDOFF_WORDS = List.of("human", "agent");
    static final String SPEAK_TO_SOMEONE = "speak to someone";

    public boolean shouldEscalate(String message, Intent intent, Sentiment sentiment) {
        return evaluate(message, intent, sentiment).escalate();
    }

    public EscalationVerdict evaluate(String message, Intent intent, Sentiment sentiment) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        Set<EscalationTrigger> triggers = EnumSet.noneOf(EscalationTrigger.class);

        if (intent == Intent.EMERGENCY) {
            triggers.add(EscalationTrigger.EMERGENCY_INTENT);
        }
        if (sentiment == Sentiment.NEGATIVE && SEVERITY_WORDS.stream().anyMatch(lower::contains)) {
            triggers.add(EscalationTrigger.NEGATIVE_WITH_SEVERITY_WORD);
        }
        if (HANDOFF_WORDS.stream().anyMatch(lower::contains)) {
            triggers.add(EscalationTrigger.HUMAN_OR_AGENT_REQUESTED);
        }
        if (lower.contains(SPEAK_TO_SOMEONE)) {
            triggers.add(EscalationTrigger.SPEAK_TO_SOMEONE);
        }
        return new EscalationVerdict(triggers);
    }
}

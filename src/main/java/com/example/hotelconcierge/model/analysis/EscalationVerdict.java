package com.example.hotelconcierge.model.analysis;

import java.util.Set;

/**
 * Resultado de la politica de escalado: escala si se disparo algun trigger.
 */
public record EscalationVerdict(Set<EscalationTrigger> triggers) {

    public EscalationVerdict {
        triggers = triggers == null ? Set.of() : Set.copyOf(triggers);
    }

    public boolean escalate() {
        return !triggers.isEmpty();
    }
}

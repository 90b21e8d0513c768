package com.example.hotelconcierge.model.dto;

import jakarta.validation.constraints.Size;

public class EscalateConversationRequest {

    /**
     * Agente humano que toma la conversacion. Opcional.
     */
    @Size(max = 36)
    private String agentId;

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }
}

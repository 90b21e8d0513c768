package com.example.hotelconcierge.model.dto;

import com.example.hotelconcierge.model.analysis.GuestContext;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class ChatRequest {

    @NotBlank
    @Size(max = 4000)
    private String message;

    /**
     * Conversacion existente; si falta se reutiliza la activa del huesped o se abre una nueva.
     */
    private String conversationId;

    /**
     * Datos del huesped: userId, name, roomNumber, guestType. Todos opcionales.
     */
    private GuestContext userContext;

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }

    public GuestContext getUserContext() { return userContext; }
    public void setUserContext(GuestContext userContext) { this.userContext = userContext; }
}

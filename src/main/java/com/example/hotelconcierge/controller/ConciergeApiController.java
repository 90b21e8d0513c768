package com.example.hotelconcierge.controller;

import com.example.hotelconcierge.model.dto.ChatReply;
import com.example.hotelconcierge.model.dto.ChatRequest;
import com.example.hotelconcierge.service.ConversationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/chat")
public class ConciergeApiController {

    private final ConversationService conversationService;

    public ConciergeApiController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    // Mensaje del huesped -> respuesta del conserje, con intencion, sentimiento y escalado
    @PostMapping
    public ChatReply chat(@Valid @RequestBody ChatRequest req) {
        return conversationService.handleMessage(req);
    }
}

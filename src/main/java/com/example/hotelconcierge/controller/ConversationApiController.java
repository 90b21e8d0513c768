package com.example.hotelconcierge.controller;

import com.example.hotelconcierge.model.dto.ConversationDto;
import com.example.hotelconcierge.model.dto.ConversationMessageDto;
import com.example.hotelconcierge.model.dto.ConversationPage;
import com.example.hotelconcierge.model.dto.EscalateConversationRequest;
import com.example.hotelconcierge.model.dto.ResolveConversationRequest;
import com.example.hotelconcierge.service.ConversationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/conversations")
public class ConversationApiController {

    private final ConversationService conversationService;

    public ConversationApiController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @GetMapping
    public ConversationPage list(@RequestParam(name = "status", required = false) String status,
                                 @RequestParam(name = "channel", required = false) String channel,
                                 @RequestParam(name = "page", required = false) Integer page,
                                 @RequestParam(name = "perPage", required = false) Integer perPage) {
        return conversationService.listConversations(status, channel, page, perPage);
    }

    @GetMapping("/{id}/messages")
    public Map<String, List<ConversationMessageDto>> messages(@PathVariable String id) {
        return Map.of("messages", conversationService.messages(id));
    }

    // Paso a agente humano: estado escalated y prioridad alta
    @PostMapping("/{id}/escalate")
    public Map<String, Object> escalate(@PathVariable String id,
                                        @Valid @RequestBody(required = false) EscalateConversationRequest req) {
        ConversationDto updated = conversationService.escalate(id, req == null ? null : req.getAgentId());
        return Map.of("message", "Conversation escalated successfully", "conversation", updated);
    }

    @PostMapping("/{id}/resolve")
    public Map<String, Object> resolve(@PathVariable String id,
                                       @Valid @RequestBody(required = false) ResolveConversationRequest req) {
        ConversationDto updated = conversationService.resolve(id, req == null ? null : req.getSatisfactionScore());
        return Map.of("message", "Conversation resolved successfully", "conversation", updated);
    }
}

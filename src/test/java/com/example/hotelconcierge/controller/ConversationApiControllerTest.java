package com.example.hotelconcierge.controller;

import com.example.hotelconcierge.model.dto.ConversationDto;
import com.example.hotelconcierge.model.dto.ConversationMessageDto;
import com.example.hotelconcierge.model.dto.ConversationPage;
import com.example.hotelconcierge.service.ConversationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversationApiController.class)
class ConversationApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ConversationService conversationService;

    @Test
    void listPassesFiltersAndPaging() throws Exception {
        when(conversationService.listConversations("active", "web", 2, 5))
                .thenReturn(new ConversationPage(List.of(dto("conv-1", "active", "normal", null, null)), 6, 2, 2));

        mockMvc.perform(get("/api/conversations")
                        .param("status", "active")
                        .param("channel", "web")
                        .param("page", "2")
                        .param("perPage", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversations[0].id").value("conv-1"))
                .andExpect(jsonPath("$.total").value(6))
                .andExpect(jsonPath("$.pages").value(2))
                .andExpect(jsonPath("$.currentPage").value(2));
    }

    @Test
    void unknownStatusFilterIsABadRequest() throws Exception {
        when(conversationService.listConversations(eq("closed"), isNull(), isNull(), isNull()))
                .thenThrow(new IllegalArgumentException("Estado de conversacion no valido: closed"));

        mockMvc.perform(get("/api/conversations").param("status", "closed"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void messagesAreWrapped() throws Exception {
        when(conversationService.messages("conv-2")).thenReturn(List.of(
                new ConversationMessageDto(1L, "conv-2", "user", "Hi", null, null, null, Instant.now()),
                new ConversationMessageDto(2L, "conv-2", "ai", "Hello!", "inquiry", 0.5, 0.1, Instant.now())));

        mockMvc.perform(get("/api/conversations/conv-2/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages[0].senderType").value("user"))
                .andExpect(jsonPath("$.messages[1].intent").value("inquiry"));
    }

    @Test
    void escalateAssignsAgent() throws Exception {
        when(conversationService.escalate("conv-3", "agent-7"))
                .thenReturn(dto("conv-3", "escalated", "high", "agent-7", null));

        mockMvc.perform(post("/api/conversations/conv-3/escalate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"agentId":"agent-7"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Conversation escalated successfully"))
                .andExpect(jsonPath("$.conversation.status").value("escalated"))
                .andExpect(jsonPath("$.conversation.priority").value("high"))
                .andExpect(jsonPath("$.conversation.agentId").value("agent-7"));
    }

    @Test
    void resolveWithoutBodyAndWithScore() throws Exception {
        when(conversationService.resolve("conv-4", null)).thenReturn(dto("conv-4", "resolved", "normal", null, null));
        when(conversationService.resolve("conv-5", 5)).thenReturn(dto("conv-5", "resolved", "normal", null, 5));

        mockMvc.perform(post("/api/conversations/conv-4/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversation.status").value("resolved"));

        mockMvc.perform(post("/api/conversations/conv-5/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"satisfactionScore":5}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Conversation resolved successfully"))
                .andExpect(jsonPath("$.conversation.satisfactionScore").value(5));
    }

    @Test
    void outOfRangeScoreIsRejected() throws Exception {
        mockMvc.perform(post("/api/conversations/conv-6/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"satisfactionScore":9}
                                """))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(conversationService);
    }

    @Test
    void unknownConversationIs404() throws Exception {
        when(conversationService.escalate(eq("nope"), any()))
                .thenThrow(new NoSuchElementException("Conversacion no encontrada: nope"));

        mockMvc.perform(post("/api/conversations/nope/escalate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Conversacion no encontrada: nope"));
    }

    private static ConversationDto dto(String id, String status, String priority, String agentId, Integer score) {
        Instant now = Instant.now();
        return new ConversationDto(id, "guest-1", "web", status, priority, "inquiry", "neutral", score, agentId,
                now, now, "resolved".equals(status) ? now : null, 2);
    }
}

package com.example.hotelconcierge.controller;

import com.example.hotelconcierge.model.dto.ChatReply;
import com.example.hotelconcierge.model.dto.ChatRequest;
import com.example.hotelconcierge.service.ConversationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConciergeApiController.class)
class ConciergeApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ConversationService conversationService;

    @Test
    void chatReturnsReplyWithAnalysis() throws Exception {
        ChatReply reply = new ChatReply("conv-1", "Checkout is at 11 AM.", "checkout", 0.2, "neutral",
                false, null, 0.05, List.of("How can I help you today?"));
        when(conversationService.handleMessage(argThat((ChatRequest r) ->
                "When is checkout?".equals(r.getMessage())
                        && r.getUserContext() != null
                        && "204".equals(r.getUserContext().roomNumber()))))
                .thenReturn(reply);

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"When is checkout?","userContext":{"userId":"g1","roomNumber":"204"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.conversationId").value("conv-1"))
                .andExpect(jsonPath("$.response").value("Checkout is at 11 AM."))
                .andExpect(jsonPath("$.intent").value("checkout"))
                .andExpect(jsonPath("$.escalate").value(false))
                .andExpect(jsonPath("$.suggestedResponses[0]").value("How can I help you today?"));
    }

    @Test
    void blankMessageIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"   "}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.details[0]").value(org.hamcrest.Matchers.startsWith("message:")));

        verifyNoInteractions(conversationService);
    }

    @Test
    void unexpectedFailureIsAnInternalError() throws Exception {
        when(conversationService.handleMessage(any())).thenThrow(new IllegalStateException("db down"));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"Hello"}
                                """))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorId").isNotEmpty());
    }
}

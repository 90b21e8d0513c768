package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.analysis.HistoryEntry;
import com.example.hotelconcierge.model.entity.ConversationMessage;
import com.example.hotelconcierge.repository.ConversationMessageRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class JpaConversationHistory implements ConversationHistory {

    private final ConversationMessageRepository messageRepo;

    public JpaConversationHistory(ConversationMessageRepository messageRepo) {
        this.messageRepo = messageRepo;
    }

    @Override
    @Transactional(readOnly = true)
    public List<HistoryEntry> recentMessages(String conversationId, int limit) {
        if (conversationId == null || conversationId.isBlank() || limit <= 0) {
            return List.of();
        }

        var newestFirst = messageRepo.findByConversation_IdOrderByCreatedAtDescIdDesc(
                conversationId, PageRequest.of(0, limit));

        List<HistoryEntry> out = new ArrayList<>(newestFirst.size());
        for (ConversationMessage m : newestFirst) {
            String role = m.getSender() == ConversationMessage.Sender.AI ? "assistant" : "user";
            out.add(new HistoryEntry(role, m.getContent()));
        }
        Collections.reverse(out);
        return out;
    }
}

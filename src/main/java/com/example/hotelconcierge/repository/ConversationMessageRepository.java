package com.example.hotelconcierge.repository;

import com.example.hotelconcierge.model.entity.ConversationMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    // Mas recientes primero; el llamador invierte el orden
    List<ConversationMessage> findByConversation_IdOrderByCreatedAtDescIdDesc(String conversationId, Pageable pageable);

    List<ConversationMessage> findByConversation_IdOrderByCreatedAtAscIdAsc(String conversationId);

    long countByConversation_Id(String conversationId);
}

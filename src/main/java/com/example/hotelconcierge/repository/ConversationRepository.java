package com.example.hotelconcierge.repository;

import com.example.hotelconcierge.model.entity.Conversation;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ConversationRepository extends JpaRepository<Conversation, String> {

    Optional<Conversation> findFirstByUserIdAndStatusOrderByUpdatedAtDesc(String userId, Conversation.Status status);

    // Orden lo pone el Pageable (createdAt desc)
    @Query(value = """
        select c
        from Conversation c
        where (:status is null or c.status = :status)
          and (:channel is null or c.channel = :channel)
    """, countQuery = """
        select count(c)
        from Conversation c
        where (:status is null or c.status = :status)
          and (:channel is null or c.channel = :channel)
    """)
    Page<Conversation> search(@Param("status") Conversation.Status status,
                              @Param("channel") String channel,
                              Pageable pageable);
}

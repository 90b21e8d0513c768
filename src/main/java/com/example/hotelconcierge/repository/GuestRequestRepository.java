package com.example.hotelconcierge.repository;

import com.example.hotelconcierge.model.entity.GuestRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface GuestRequestRepository extends JpaRepository<GuestRequest, String> {

    @Query("""
        select r
        from GuestRequest r
        where (:status is null or r.status = :status)
          and (:priority is null or r.priority = :priority)
        order by r.createdAt desc
    """)
    List<GuestRequest> search(@Param("status") GuestRequest.Status status,
                              @Param("priority") GuestRequest.Priority priority);

    List<GuestRequest> findByConversationIdOrderByCreatedAtAsc(String conversationId);
}

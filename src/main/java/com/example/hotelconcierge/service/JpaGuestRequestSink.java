package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.entity.GuestRequest;
import com.example.hotelconcierge.model.request.GuestRequestFields;
import com.example.hotelconcierge.repository.GuestRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Component
public class JpaGuestRequestSink implements GuestRequestSink {

    private static final Logger log = LoggerFactory.getLogger(JpaGuestRequestSink.class);

    private final GuestRequestRepository requestRepo;

    public JpaGuestRequestSink(GuestRequestRepository requestRepo) {
        this.requestRepo = requestRepo;
    }

    @Override
    @Transactional
    public String createRequest(GuestRequestFields fields) {
        GuestRequest request = new GuestRequest();
        request.setId(UUID.randomUUID().toString());
        request.setConversationId(fields.conversationId());
        request.setUserId(fields.userId());
        request.setType(fields.type());
        request.setTitle(fields.title());
        request.setDescription(fields.description());
        request.setPriority(fields.priority());
        request.setRoomNumber(fields.roomNumber());

        GuestRequest saved = requestRepo.save(request);
        log.info("Peticion de huesped registrada id={} type={} priority={} conversation={}",
                saved.getId(), saved.getType(), saved.getPriority(), saved.getConversationId());
        return saved.getId();
    }
}

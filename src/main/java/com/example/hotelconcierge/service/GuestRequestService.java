package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.dto.GuestRequestDto;
import com.example.hotelconcierge.model.dto.UpdateRequestStatusRequest;
import com.example.hotelconcierge.model.entity.GuestRequest;
import com.example.hotelconcierge.repository.GuestRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Seguimiento de peticiones de huespedes por parte del personal.
 */
@Service
public class GuestRequestService {

    private static final Logger log = LoggerFactory.getLogger(GuestRequestService.class);

    private final GuestRequestRepository requestRepo;

    public GuestRequestService(GuestRequestRepository requestRepo) {
        this.requestRepo = requestRepo;
    }

    /**
     * Mas recientes primero. Filtros opcionales; un valor desconocido es IllegalArgumentException.
     */
    @Transactional(readOnly = true)
    public List<GuestRequestDto> list(String status, String priority) {
        GuestRequest.Status s = hasText(status) ? GuestRequest.Status.fromWireName(status) : null;
        GuestRequest.Priority p = hasText(priority) ? GuestRequest.Priority.fromWireName(priority) : null;
        return requestRepo.search(s, p).stream().map(GuestRequestDto::of).toList();
    }

    @Transactional
    public GuestRequestDto updateStatus(String requestId, UpdateRequestStatusRequest req) {
        GuestRequest request = requestRepo.findById(requestId)
                .orElseThrow(() -> new NoSuchElementException("Peticion no encontrada: " + requestId));

        GuestRequest.Status previous = request.getStatus();
        GuestRequest.Status next = hasText(req.getStatus())
                ? GuestRequest.Status.fromWireName(req.getStatus())
                : previous;
        request.setStatus(next);

        if (next == GuestRequest.Status.COMPLETED && request.getCompletedAt() == null) {
            request.setCompletedAt(Instant.now());
        }
        if (hasText(req.getAssignedTo())) {
            request.setAssignedTo(req.getAssignedTo().trim());
        }
        if (req.getNotes() != null) {
            request.setNotes(req.getNotes());
        }

        GuestRequest saved = requestRepo.save(request);
        log.info("Peticion id={} estado {} -> {} assignedTo={}",
                saved.getId(), previous.wireName(), next.wireName(), saved.getAssignedTo());
        return GuestRequestDto.of(saved);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}

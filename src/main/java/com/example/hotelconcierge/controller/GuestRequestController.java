package com.example.hotelconcierge.controller;

import com.example.hotelconcierge.model.dto.GuestRequestDto;
import com.example.hotelconcierge.model.dto.UpdateRequestStatusRequest;
import com.example.hotelconcierge.service.GuestRequestService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/requests")
public class GuestRequestController {

    private final GuestRequestService requestService;

    public GuestRequestController(GuestRequestService requestService) {
        this.requestService = requestService;
    }

    @GetMapping
    public List<GuestRequestDto> list(@RequestParam(name = "status", required = false) String status,
                                      @RequestParam(name = "priority", required = false) String priority) {
        return requestService.list(status, priority);
    }

    @PutMapping("/{id}/status")
    public GuestRequestDto updateStatus(@PathVariable String id, @Valid @RequestBody UpdateRequestStatusRequest req) {
        return requestService.updateStatus(id, req);
    }
}

package com.example.hotelconcierge.model.request;

import com.example.hotelconcierge.model.entity.GuestRequest;

/**
 * Campos con los que se da de alta una peticion de huesped.
 */
public record GuestRequestFields(String conversationId,
                                 String userId,
                                 GuestRequest.Type type,
                                 String title,
                                 String description,
                                 GuestRequest.Priority priority,
                                 String roomNumber) {
}

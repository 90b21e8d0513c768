package com.example.hotelconcierge.model.analysis;

/**
 * Datos opcionales del huesped que acompañan al mensaje.
 */
public record GuestContext(String userId, String name, String roomNumber, String guestType) {

    public static GuestContext empty() {
        return new GuestContext(null, null, null, null);
    }

    public String userIdOrUnknown() {
        return (userId == null || userId.isBlank()) ? "unknown" : userId.trim();
    }
}

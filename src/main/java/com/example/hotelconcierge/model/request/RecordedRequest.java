package com.example.hotelconcierge.model.request;

/**
 * Peticion ya registrada en el sistema de seguimiento.
 */
public record RecordedRequest(String requestId, GuestRequestFields fields) {

    private static final int SHORT_ID_LENGTH = 8;

    public String confirmation() {
        String shortId = requestId.length() > SHORT_ID_LENGTH ? requestId.substring(0, SHORT_ID_LENGTH) : requestId;
        return "Request #" + shortId + " has been recorded and will be processed.";
    }
}

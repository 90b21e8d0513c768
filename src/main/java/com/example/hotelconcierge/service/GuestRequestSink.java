package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.request.GuestRequestFields;

/**
 * Destino de las peticiones de huesped. Es la unica escritura que hace el pipeline de mensajes.
 */
public interface GuestRequestSink {

    /**
     * Registra la peticion y devuelve su identificador.
     */
    String createRequest(GuestRequestFields fields);
}

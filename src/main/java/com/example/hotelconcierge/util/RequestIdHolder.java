package com.example.hotelconcierge.util;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * requestId del hilo actual, guardado en el MDC para que salga en cada linea de log.
 */
public final class RequestIdHolder {

    public static final String MDC_KEY = "requestId";

    // Ids que llegan de fuera: cortos y sin caracteres que ensucien el log
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private RequestIdHolder() {
    }

    public static String get() {
        String id = MDC.get(MDC_KEY);
        return (id == null || id.isBlank()) ? null : id;
    }

    /**
     * Id recibido en cabecera si es valido; si no, uno nuevo.
     */
    public static String accept(String incoming) {
        String clean = incoming == null ? "" : incoming.trim();
        return SAFE_ID.matcher(clean).matches() ? clean : generate();
    }

    public static String ensure() {
        String id = get();
        if (id == null) {
            id = generate();
            set(id);
        }
        return id;
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static void set(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            clear();
            return;
        }
        MDC.put(MDC_KEY, requestId);
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }
}

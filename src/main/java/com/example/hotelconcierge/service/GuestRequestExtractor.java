package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.analysis.GuestContext;
import com.example.hotelconcierge.model.analysis.Intent;
import com.example.hotelconcierge.model.entity.GuestRequest;
import com.example.hotelconcierge.model.request.GuestRequestFields;
import com.example.hotelconcierge.model.request.RecordedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Convierte mensajes con intencion "registrable" en una peticion de huesped.
 * Como mucho una peticion por llamada.
 */
@Component
public class GuestRequestExtractor {

    private static final Logger log = LoggerFactory.getLogger(GuestRequestExtractor.class);

    static final int TITLE_MAX_WORDS = 8;
    static final List<String> URGENT_KEYWORDS = List.of("urgent", "emergency", "asap", "immediately", "now");
    static final List<String> HIGH_KEYWORDS = List.of("important", "soon", "quickly", "priority");

    private static final Map<Intent, GuestRequest.Type> RECORDABLE = new EnumMap<>(Map.of(
            Intent.SERVICE_REQUEST, GuestRequest.Type.ROOM_SERVICE,
            Intent.GUEST_REQUEST, GuestRequest.Type.CONCIERGE,
            Intent.CONCIERGE_REQUEST, GuestRequest.Type.CONCIERGE
    ));

    private final GuestRequestSink sink;

    public GuestRequestExtractor(GuestRequestSink sink) {
        this.sink = sink;
    }

    public static boolean isRecordable(Intent intent) {
        return intent != null && RECORDABLE.containsKey(intent);
    }

    public Optional<RecordedRequest> maybeExtract(String conversationId,
                                                  String userId,
                                                  String message,
                                                  Intent intent,
                                                  GuestContext context) {
        if (!isRecordable(intent) || message == null) {
            return Optional.empty();
        }

        GuestContext ctx = context == null ? GuestContext.empty() : context;
        GuestRequestFields fields = new GuestRequestFields(
                conversationId,
                userId,
                requestType(intent),
                title(message),
                message,
                priority(message),
                ctx.roomNumber()
        );

        String requestId;
        try {
            requestId = sink.createRequest(fields);
        } catch (RuntimeException e) {
            // Sin registro no hay confirmacion, pero el huesped recibe su respuesta
            log.warn("No se pudo registrar la peticion conversation={} type={}: {}",
                    conversationId, fields.type(), e.getMessage());
            return Optional.empty();
        }
        log.debug("Peticion extraida intent={} type={} priority={}", intent.wireName(), fields.type(), fields.priority());
        return Optional.of(new RecordedRequest(requestId, fields));
    }

    static GuestRequest.Type requestType(Intent intent) {
        return RECORDABLE.getOrDefault(intent, GuestRequest.Type.CONCIERGE);
    }

    static String title(String message) {
        String trimmed = message.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return Arrays.stream(trimmed.split("\\s+"))
                .limit(TITLE_MAX_WORDS)
                .collect(Collectors.joining(" "));
    }

    static GuestRequest.Priority priority(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (URGENT_KEYWORDS.stream().anyMatch(lower::contains)) {
            return GuestRequest.Priority.URGENT;
        }
        if (HIGH_KEYWORDS.stream().anyMatch(lower::contains)) {
            return GuestRequest.Priority.HIGH;
        }
        return GuestRequest.Priority.MEDIUM;
    }
}

package com.example.hotelconcierge.service;

import com.example.hotelconcierge.config.HotelProperties;
import com.example.hotelconcierge.config.OllamaProperties;
import com.example.hotelconcierge.config.RagProperties;
import com.example.hotelconcierge.model.analysis.ClassificationResult;
import com.example.hotelconcierge.model.analysis.EscalationVerdict;
import com.example.hotelconcierge.model.analysis.GuestContext;
import com.example.hotelconcierge.model.analysis.HistoryEntry;
import com.example.hotelconcierge.model.analysis.Sentiment;
import com.example.hotelconcierge.model.dto.ConciergeReply;
import com.example.hotelconcierge.model.request.RecordedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pipeline de un mensaje de huesped:
 * 1) intencion y sentimiento
 * 2) historico reciente
 * 3) contexto de documentos del hotel
 * 4) registro de peticion si procede
 * 5) respuesta del modelo o, si no hay modelo, respuesta por reglas
 * 6) decision de escalado
 */
@Service
public class ConciergeService {

    private static final Logger log = LoggerFactory.getLogger(ConciergeService.class);

    private final IntentClassifier classifier;
    private final SentimentAnalyzer sentimentAnalyzer;
    private final EscalationPolicy escalationPolicy;
    private final GuestRequestExtractor requestExtractor;
    private final FallbackResponseComposer composer;
    private final RetrievalService retrieval;
    private final ConversationHistory history;
    private final OllamaClient ollama;
    private final OllamaProperties ollamaProps;
    private final RagProperties ragProps;
    private final HotelProperties hotel;

    public ConciergeService(IntentClassifier classifier,
                            SentimentAnalyzer sentimentAnalyzer,
                            EscalationPolicy escalationPolicy,
                            GuestRequestExtractor requestExtractor,
                            FallbackResponseComposer composer,
                            RetrievalService retrieval,
                            ConversationHistory history,
                            OllamaClient ollama,
                            OllamaProperties ollamaProps,
                            RagProperties ragProps,
                            HotelProperties hotel) {
        this.classifier = classifier;
        this.sentimentAnalyzer = sentimentAnalyzer;
        this.escalationPolicy = escalationPolicy;
        this.requestExtractor = requestExtractor;
        this.composer = composer;
        this.retrieval = retrieval;
        this.history = history;
        this.ollama = ollama;
        this.ollamaProps = ollamaProps;
        this.ragProps = ragProps;
        this.hotel = hotel;
    }

    public ConciergeReply respond(String message, String conversationId, GuestContext guest) {
        long startNanos = System.nanoTime();
        GuestContext ctx = guest == null ? GuestContext.empty() : guest;

        try {
            ClassificationResult classification = classifier.classify(message);
            Sentiment sentiment = sentimentAnalyzer.analyze(message);

            List<HistoryEntry> recent = history.recentMessages(conversationId, ragProps.getHistoryLimit());
            String documentContext = retrieval.documentContext(message);

            Optional<RecordedRequest> recorded = requestExtractor.maybeExtract(
                    conversationId, ctx.userIdOrUnknown(), message, classification.intent(), ctx);
            String confirmation = recorded.map(RecordedRequest::confirmation).orElse(null);

            String response = generate(message, recent, ctx, documentContext)
                    .orElseGet(() -> composer.compose(message, classification.intent(), documentContext, confirmation));

            EscalationVerdict verdict = escalationPolicy.evaluate(message, classification.intent(), sentiment);
            double elapsed = elapsedSeconds(startNanos);

            log.info("Respuesta conversation={} intent={} confidence={} sentiment={} escalate={} request={} elapsedMs={}",
                    conversationId,
                    classification.intent().wireName(),
                    String.format(Locale.US, "%.2f", classification.confidence()),
                    sentiment.wireName(),
                    verdict.escalate(),
                    recorded.map(RecordedRequest::requestId).orElse("-"),
                    String.format(Locale.US, "%.1f", elapsed * 1000));

            return new ConciergeReply(
                    response,
                    classification.intent().wireName(),
                    classification.confidence(),
                    sentiment.wireName(),
                    elapsed,
                    verdict.escalate(),
                    verdict.triggers().stream().map(Enum::name).sorted().toList(),
                    recorded.map(RecordedRequest::requestId).orElse(null),
                    null
            );
        } catch (RuntimeException e) {
            log.error("Fallo procesando mensaje conversation={}; se responde con disculpa y escalado", conversationId, e);
            return ConciergeReply.failure(e.getMessage(), elapsedSeconds(startNanos));
        }
    }

    /**
     * Respuesta del modelo generativo; vacio si esta desactivado o no responde.
     */
    private Optional<String> generate(String message,
                                      List<HistoryEntry> recent,
                                      GuestContext ctx,
                                      String documentContext) {
        if (!ollamaProps.isChatEnabled()) {
            return Optional.empty();
        }

        List<OllamaClient.Message> msgs = new ArrayList<>();
        msgs.add(new OllamaClient.Message("system",
                systemPrompt() + "\n\nCURRENT CONTEXT:\n" + contextInfo(ctx, documentContext)));
        for (HistoryEntry entry : recent) {
            msgs.add(new OllamaClient.Message(entry.role(), entry.content()));
        }
        msgs.add(new OllamaClient.Message("user", message));

        try {
            String text = ollama.chat(msgs);
            return (text == null || text.isBlank()) ? Optional.empty() : Optional.of(text);
        } catch (RestClientException | IllegalStateException e) {
            log.warn("Modelo de chat no disponible, se usa respuesta por reglas: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String contextInfo(GuestContext ctx, String documentContext) {
        StringBuilder sb = new StringBuilder();
        if (hasText(ctx.name())) {
            sb.append("Guest Name: ").append(ctx.name()).append('\n');
        }
        if (hasText(ctx.roomNumber())) {
            sb.append("Room Number: ").append(ctx.roomNumber()).append('\n');
        }
        if (hasText(ctx.guestType())) {
            sb.append("Guest Type: ").append(ctx.guestType()).append('\n');
        }
        if (hasText(documentContext)) {
            sb.append("\nRelevant Hotel Information:\n").append(documentContext);
        }
        return sb.toString();
    }

    String systemPrompt() {
        return """
                You are a knowledgeable hotel concierge AI assistant for %s. Your primary role is to provide helpful, \
                direct answers to guest questions and assist with their needs.

                HOTEL INFORMATION:
                - Name: %s
                - Phone: %s
                - Email: %s
                - Address: %s

                YOUR ROLE:
                - Answer guest questions directly and comprehensively
                - Provide detailed information about hotel amenities, policies, and services
                - Offer local recommendations and travel advice
                - Handle service requests and bookings

                RESPONSE STYLE:
                1. Always provide direct, helpful answers first
                2. Be informative and specific in your responses
                3. Use a warm, professional, and welcoming tone
                4. Only suggest contacting staff for tasks that require human intervention

                WHEN TO ESCALATE TO HUMAN STAFF:
                - Actual room bookings or reservations
                - Billing issues or payment problems
                - Medical emergencies or safety concerns
                - Maintenance issues requiring immediate attention
                - Complaints requiring manager intervention""".formatted(
                hotel.getName(), hotel.getName(), hotel.getPhone(), hotel.getEmail(), hotel.getAddress());
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}

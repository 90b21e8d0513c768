package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.analysis.GuestContext;
import com.example.hotelconcierge.model.dto.ChatReply;
import com.example.hotelconcierge.model.dto.ChatRequest;
import com.example.hotelconcierge.model.dto.ConciergeReply;
import com.example.hotelconcierge.model.dto.ConversationDto;
import com.example.hotelconcierge.model.dto.ConversationMessageDto;
import com.example.hotelconcierge.model.dto.ConversationPage;
import com.example.hotelconcierge.model.entity.Conversation;
import com.example.hotelconcierge.model.entity.ConversationMessage;
import com.example.hotelconcierge.repository.ConversationMessageRepository;
import com.example.hotelconcierge.repository.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Conversacion web: localiza o abre la conversacion, delega la respuesta y guarda ambos mensajes.
 * Tambien da al personal el listado, el historial, el escalado y el cierre de conversaciones.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    private final ConversationRepository conversationRepo;
    private final ConversationMessageRepository messageRepo;
    private final ConciergeService concierge;
    private final SuggestedResponses suggestions;

    public ConversationService(ConversationRepository conversationRepo,
                               ConversationMessageRepository messageRepo,
                               ConciergeService concierge,
                               SuggestedResponses suggestions) {
        this.conversationRepo = conversationRepo;
        this.messageRepo = messageRepo;
        this.concierge = concierge;
        this.suggestions = suggestions;
    }

    public ChatReply handleMessage(ChatRequest req) {
        String message = req.getMessage() == null ? "" : req.getMessage().trim();
        if (message.isEmpty()) {
            throw new IllegalArgumentException("El mensaje no puede estar vacio");
        }

        GuestContext guest = req.getUserContext() == null ? GuestContext.empty() : req.getUserContext();
        Conversation conversation = findOrOpenConversation(req.getConversationId(), guest);

        // El mensaje del huesped se fecha antes de generar la respuesta
        ConversationMessage userMsg = new ConversationMessage();
        userMsg.setConversation(conversation);
        userMsg.setSender(ConversationMessage.Sender.USER);
        userMsg.setContent(message);

        ConciergeReply reply = concierge.respond(message, conversation.getId(), guest);

        messageRepo.save(userMsg);

        ConversationMessage aiMsg = new ConversationMessage();
        aiMsg.setConversation(conversation);
        aiMsg.setSender(ConversationMessage.Sender.AI);
        aiMsg.setContent(reply.response());
        aiMsg.setIntent(reply.intent());
        aiMsg.setConfidence(reply.confidence());
        aiMsg.setProcessingTimeSeconds(reply.processingTimeSeconds());
        messageRepo.save(aiMsg);

        conversation.setCategory(reply.intent());
        conversation.setSentiment(reply.sentiment());
        if (reply.escalate()) {
            conversation.setPriority(Conversation.Priority.HIGH);
            log.info("Conversacion escalada id={} triggers={}", conversation.getId(), reply.escalationTriggers());
        }
        conversationRepo.save(conversation);

        return new ChatReply(
                conversation.getId(),
                reply.response(),
                reply.intent(),
                reply.confidence(),
                reply.sentiment(),
                reply.escalate(),
                reply.requestId(),
                reply.processingTimeSeconds(),
                suggestions.forWireName(reply.intent())
        );
    }

    /**
     * Pagina de conversaciones, mas recientes primero. {@code page} empieza en 1.
     */
    @Transactional(readOnly = true)
    public ConversationPage listConversations(String status, String channel, Integer page, Integer perPage) {
        Conversation.Status s = hasText(status) ? Conversation.Status.fromWireName(status) : null;
        String ch = hasText(channel) ? channel.trim() : null;
        int current = page == null ? 1 : Math.max(page, 1);
        int size = perPage == null ? DEFAULT_PAGE_SIZE : Math.min(Math.max(perPage, 1), MAX_PAGE_SIZE);

        Page<Conversation> result = conversationRepo.search(s, ch,
                PageRequest.of(current - 1, size, Sort.by(Sort.Direction.DESC, "createdAt")));
        List<ConversationDto> items = result.getContent().stream()
                .map(c -> ConversationDto.of(c, messageRepo.countByConversation_Id(c.getId())))
                .toList();
        return new ConversationPage(items, result.getTotalElements(), result.getTotalPages(), current);
    }

    /**
     * Mensajes en orden de creacion. Una conversacion desconocida no tiene mensajes.
     */
    @Transactional(readOnly = true)
    public List<ConversationMessageDto> messages(String conversationId) {
        return messageRepo.findByConversation_IdOrderByCreatedAtAscIdAsc(conversationId).stream()
                .map(m -> ConversationMessageDto.of(m, conversationId))
                .toList();
    }

    @Transactional
    public ConversationDto escalate(String conversationId, String agentId) {
        Conversation conversation = find(conversationId);
        conversation.setStatus(Conversation.Status.ESCALATED);
        conversation.setAgentId(hasText(agentId) ? agentId.trim() : null);
        conversation.setPriority(Conversation.Priority.HIGH);
        Conversation saved = conversationRepo.save(conversation);
        log.info("Conversacion escalada a agente id={} agent={}", saved.getId(), saved.getAgentId());
        return ConversationDto.of(saved, messageRepo.countByConversation_Id(saved.getId()));
    }

    @Transactional
    public ConversationDto resolve(String conversationId, Integer satisfactionScore) {
        Conversation conversation = find(conversationId);
        conversation.setStatus(Conversation.Status.RESOLVED);
        conversation.setResolvedAt(Instant.now());
        if (satisfactionScore != null) {
            conversation.setSatisfactionScore(satisfactionScore);
        }
        Conversation saved = conversationRepo.save(conversation);
        log.info("Conversacion resuelta id={} satisfaction={}", saved.getId(), saved.getSatisfactionScore());
        return ConversationDto.of(saved, messageRepo.countByConversation_Id(saved.getId()));
    }

    private Conversation find(String conversationId) {
        return conversationRepo.findById(conversationId)
                .orElseThrow(() -> new NoSuchElementException("Conversacion no encontrada: " + conversationId));
    }

    private Conversation findOrOpenConversation(String conversationId, GuestContext guest) {
        if (conversationId != null && !conversationId.isBlank()) {
            Optional<Conversation> existing = conversationRepo.findById(conversationId.trim());
            if (existing.isPresent()) {
                return existing.get();
            }
        }

        String userId = guest.userIdOrUnknown();
        // Los anonimos no comparten conversacion
        if (guest.userId() != null && !guest.userId().isBlank()) {
            Optional<Conversation> active = conversationRepo
                    .findFirstByUserIdAndStatusOrderByUpdatedAtDesc(userId, Conversation.Status.ACTIVE);
            if (active.isPresent()) {
                return active.get();
            }
        }

        Conversation created = new Conversation();
        created.setId(UUID.randomUUID().toString());
        created.setUserId(userId);
        created.setChannel("web");
        Conversation saved = conversationRepo.save(created);
        log.debug("Conversacion nueva id={} user={}", saved.getId(), userId);
        return saved;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}

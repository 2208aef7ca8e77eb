package com.hotelbot.assistant.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotelbot.assistant.error.ChatProcessingException;
import com.hotelbot.assistant.error.UnauthenticatedException;
import com.hotelbot.assistant.error.ValidationException;
import com.hotelbot.assistant.model.Conversation;
import com.hotelbot.assistant.model.Turn;
import com.hotelbot.assistant.model.User;
import com.hotelbot.assistant.repo.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one chat turn per call: user turn, model call, at most one function call, final
 * assistant reply. The stored transcript is replaced only once the reply exists, so a
 * failed turn leaves the previous transcript as it was.
 */
@Service
public class ConversationService {
    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    static final String DEFAULT_PERSONA = String.join("\n",
            "You are a polite and helpful hotel booking assistant chatbot. Always maintain a friendly and professional tone.",
            "Key points:",
            "1. If asked \"Who are you?\", explain that you're a hotel booking assistant chatbot.",
            "2. If asked \"Who am I?\", provide details about the user if available.",
            "3. If faced with inappropriate language or queries, respond ethically and professionally, redirecting the conversation to booking-related topics.",
            "4. Guide users through the booking process: greeting, showing rooms, asking for nights of stay, calculating price, confirming booking, and processing payment.",
            "5. When a booking is confirmed, always provide the booking ID returned by the booking system to the user.",
            "6. Ask for payment after a booking is confirmed. Use the process_payment function to process payments.",
            "7. Provide check-in and check-out dates when asked or after a successful booking.",
            "8. You can communicate in any language the user prefers.");

    private final ConversationRepository conversations;
    private final UserService users;
    private final LlmService llm;
    private final FunctionCallDispatcher dispatcher;
    private final KeyedLockService locks;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String persona;
    private final long lockWaitMs;

    public ConversationService(ConversationRepository conversations,
                               UserService users,
                               LlmService llm,
                               FunctionCallDispatcher dispatcher,
                               KeyedLockService locks,
                               ObjectMapper mapper,
                               Clock clock,
                               @Value("${assistant.persona:}") String persona,
                               @Value("${chat.lock.waitMs:30000}") long lockWaitMs) {
        this.conversations = conversations;
        this.users = users;
        this.llm = llm;
        this.dispatcher = dispatcher;
        this.locks = locks;
        this.mapper = mapper;
        this.clock = clock;
        this.persona = (persona == null || persona.isBlank()) ? DEFAULT_PERSONA : persona.trim();
        this.lockWaitMs = lockWaitMs;
    }

    public record ChatReply(List<Turn> messages) {}

    public ChatReply handleTurn(String userId, String text) {
        if (userId == null || userId.isBlank()) {
            throw new UnauthenticatedException();
        }
        if (text == null || text.isBlank()) {
            throw new ValidationException("message is required");
        }
        try {
            return locks.withLock("chat:" + userId, lockWaitMs, () -> runTurn(userId, text));
        } catch (KeyedLockService.LockTimeoutException e) {
            log.warn("Chat turn for {} rejected, previous turn still running", userId);
            throw new ChatProcessingException("turn already in progress", e);
        }
    }

    private ChatReply runTurn(String userId, String text) {
        try {
            User user = users.touch(userId);
            Conversation conversation = conversations.findById(userId).orElseGet(() -> {
                Conversation c = new Conversation();
                c.setUserId(userId);
                c.setCreatedAt(OffsetDateTime.now(clock));
                return c;
            });
            List<Turn> transcript = new ArrayList<>();
            if (conversation.getMessages() != null) {
                transcript.addAll(conversation.getMessages());
            }
            transcript.add(Turn.user(text));

            String systemPrompt = systemPrompt(user);
            List<Map<String, Object>> functions = dispatcher.functionDefinitions();
            LlmService.ModelReply reply = llm.complete(systemPrompt, transcript, functions, true)
                    .orElseThrow(() -> new ChatProcessingException("model unavailable"));

            if (reply.hasFunctionCall()) {
                FunctionCallDispatcher.DispatchResult result = dispatcher.dispatch(userId, reply.functionCall());
                transcript.add(Turn.functionResult(result.name(), result.arguments(), result.content()));
                reply = llm.complete(systemPrompt, transcript, functions, false)
                        .orElseThrow(() -> new ChatProcessingException("model unavailable after " + result.name()));
            }
            if (reply.content() == null || reply.content().isBlank()) {
                throw new ChatProcessingException("model produced no final reply");
            }
            transcript.add(Turn.assistant(reply.content()));

            conversation.setMessages(transcript);
            conversation.setUpdatedAt(OffsetDateTime.now(clock));
            conversations.save(conversation);
            return new ChatReply(List.copyOf(transcript));
        } catch (ChatProcessingException e) {
            log.warn("Chat turn failed for {}: {}", userId, e.getDiagnostic());
            throw e;
        } catch (RuntimeException e) {
            log.error("Chat turn failed for {}", userId, e);
            throw new ChatProcessingException(e.toString(), e);
        }
    }

    String systemPrompt(User user) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("userId", user.getUserId());
        snapshot.put("fullName", user.getFullName());
        snapshot.put("email", user.getEmail());
        snapshot.put("lastInteraction", user.getLastInteraction() == null ? null : user.getLastInteraction().toString());
        String details;
        try {
            details = mapper.writeValueAsString(snapshot);
        } catch (Exception e) {
            details = "{}";
        }
        return persona + "\nUser details: " + details;
    }

    public List<Conversation> getConversations(String userId) {
        return conversations.findById(userId).map(List::of).orElse(List.of());
    }
}

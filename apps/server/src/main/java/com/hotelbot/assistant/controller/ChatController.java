package com.hotelbot.assistant.controller;

import com.hotelbot.assistant.error.UnauthenticatedException;
import com.hotelbot.assistant.service.ConversationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@CrossOrigin(origins = "*", allowCredentials = "false")
public class ChatController {
    private final ConversationService conversations;

    public ChatController(ConversationService conversations) {
        this.conversations = conversations;
    }

    public record ChatRequest(String userId, String message) {}

    @PostMapping("/chat")
    public ResponseEntity<?> chat(@RequestBody(required = false) ChatRequest req) {
        if (req == null || req.userId() == null || req.userId().isBlank()) {
            throw new UnauthenticatedException();
        }
        ConversationService.ChatReply reply = conversations.handleTurn(req.userId(), req.message());
        return ResponseEntity.ok(Map.of("messages", reply.messages()));
    }

    @GetMapping("/conversations/{userId}")
    public ResponseEntity<?> conversations(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(conversations.getConversations(userId));
    }
}

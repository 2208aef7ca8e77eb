package com.hotelbot.assistant.controller;

import com.hotelbot.assistant.repo.BookingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** Liveness plus a cheap database probe; 503 when the ledger cannot be read. */
@RestController
@RequestMapping("/api/v1")
public class HealthController {
    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final BookingRepository bookings;
    private final boolean llmConfigured;
    private final String inventoryBaseUrl;

    public HealthController(BookingRepository bookings,
                            @Value("${llm.openai.apiKey:}") String llmApiKey,
                            @Value("${inventory.baseUrl:https://bot9assignement.deno.dev}") String inventoryBaseUrl) {
        this.bookings = bookings;
        this.llmConfigured = llmApiKey != null && !llmApiKey.isBlank();
        this.inventoryBaseUrl = inventoryBaseUrl;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean dbUp;
        try {
            bookings.count();
            dbUp = true;
        } catch (RuntimeException e) {
            log.warn("Health probe: database unreachable: {}", e.toString());
            dbUp = false;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("service", "hotel-booking-assistant-server");
        data.put("status", dbUp ? "healthy" : "degraded");
        data.put("database", dbUp ? "up" : "down");
        data.put("llmConfigured", llmConfigured);
        data.put("inventory", inventoryBaseUrl);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", dbUp ? 0 : 1);
        body.put("message", dbUp ? "ok" : "database unavailable");
        body.put("data", data);
        return ResponseEntity.status(dbUp ? 200 : 503).body(body);
    }
}

package com.hotelbot.assistant.controller;

import com.hotelbot.assistant.service.PaymentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

@RestController
@CrossOrigin(origins = "*", allowCredentials = "false")
public class PaymentController {
    private final PaymentService payments;

    public PaymentController(PaymentService payments) {
        this.payments = payments;
    }

    public record PaymentRequest(String bookingId, BigDecimal amount, String method) {}

    /** A declined payment is a normal 200 answer with {@code status: failed}. */
    @PostMapping("/process-payment")
    public ResponseEntity<?> process(@RequestBody PaymentRequest req) {
        return ResponseEntity.ok(payments.processPayment(req.bookingId(), req.amount(), req.method()));
    }

    @GetMapping("/payment-attempts/{bookingId}")
    public ResponseEntity<?> attempts(@PathVariable("bookingId") String bookingId) {
        return ResponseEntity.ok(payments.getAttempts(bookingId));
    }
}

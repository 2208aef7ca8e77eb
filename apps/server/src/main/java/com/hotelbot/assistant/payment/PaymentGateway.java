package com.hotelbot.assistant.payment;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

/**
 * Settles an amount against a booking. Implementations complete the future with a
 * {@link GatewayResponse}; a decline is a normal completion, not an exceptional one.
 */
public interface PaymentGateway {

    CompletableFuture<GatewayResponse> charge(Charge charge);

    record Charge(String bookingId, BigDecimal amount, PaymentMethod method, String attemptId) {}

    record GatewayResponse(boolean success, String transactionId, String message) {
        public static GatewayResponse approved(String transactionId) {
            return new GatewayResponse(true, transactionId, "Payment processed successfully");
        }

        public static GatewayResponse declined(String message) {
            return new GatewayResponse(false, null, message);
        }
    }
}

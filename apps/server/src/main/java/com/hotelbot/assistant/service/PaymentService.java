package com.hotelbot.assistant.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.hotelbot.assistant.error.NotFoundException;
import com.hotelbot.assistant.error.ValidationException;
import com.hotelbot.assistant.model.Booking;
import com.hotelbot.assistant.model.PaymentAttempt;
import com.hotelbot.assistant.payment.PaymentGateway;
import com.hotelbot.assistant.payment.PaymentMethod;
import com.hotelbot.assistant.repo.BookingRepository;
import com.hotelbot.assistant.repo.PaymentAttemptRepository;
import com.hotelbot.assistant.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Settles bookings through the {@link PaymentGateway}. A decline is reported back to the
 * caller as a {@code failed} result, never retried here, and never clears an earlier payment.
 */
@Service
public class PaymentService {
    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_FAILED = "failed";
    static final String RETRY_MESSAGE = "Payment processing failed. Please try again.";

    private final BookingRepository bookings;
    private final PaymentAttemptRepository attempts;
    private final PaymentGateway gateway;
    private final KeyedLockService locks;
    private final IdGenerator ids;
    private final Clock clock;
    private final long gatewayTimeoutMs;
    private final long lockWaitMs;

    public PaymentService(BookingRepository bookings,
                          PaymentAttemptRepository attempts,
                          PaymentGateway gateway,
                          KeyedLockService locks,
                          IdGenerator ids,
                          Clock clock,
                          @Value("${payment.gateway.timeoutMs:5000}") long gatewayTimeoutMs,
                          @Value("${payment.lock.waitMs:10000}") long lockWaitMs) {
        this.bookings = bookings;
        this.attempts = attempts;
        this.gateway = gateway;
        this.locks = locks;
        this.ids = ids;
        this.clock = clock;
        this.gatewayTimeoutMs = gatewayTimeoutMs;
        this.lockWaitMs = lockWaitMs;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PaymentResult(String status, String message, String transactionId) {
        @JsonIgnore
        public boolean isSuccess() { return STATUS_SUCCESS.equals(status); }
    }

    public PaymentResult processPayment(String bookingId, BigDecimal amount, String method) {
        if (bookingId == null || bookingId.isBlank()) {
            throw new ValidationException("bookingId is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("amount must be positive");
        }
        PaymentMethod pm = PaymentMethod.fromCode(method)
                .orElseThrow(() -> new ValidationException("method must be one of " + PaymentMethod.codes()));
        try {
            return locks.withLock("payment:" + bookingId, lockWaitMs, () -> settle(bookingId, amount, pm));
        } catch (KeyedLockService.LockTimeoutException e) {
            log.warn("Payment for booking {} skipped, another settlement is in progress", bookingId);
            return new PaymentResult(STATUS_FAILED, RETRY_MESSAGE, null);
        }
    }

    private PaymentResult settle(String bookingId, BigDecimal amount, PaymentMethod method) {
        Booking booking = bookings.findById(bookingId).orElseThrow(() -> new NotFoundException("Booking not found"));
        if (booking.isPaid()) {
            log.info("Booking {} already paid (txn={}), gateway not called", bookingId, booking.getTransactionId());
            return new PaymentResult(STATUS_SUCCESS,
                    "Booking " + bookingId + " is already paid. Transaction ID: " + booking.getTransactionId(),
                    booking.getTransactionId());
        }
        if (booking.getTotalAmount() != null && booking.getTotalAmount().compareTo(amount) != 0) {
            log.warn("Payment amount {} differs from booking {} total {}", amount, bookingId, booking.getTotalAmount());
        }

        PaymentAttempt attempt = new PaymentAttempt();
        attempt.setAttemptId(ids.newId());
        attempt.setBookingId(bookingId);
        attempt.setAmount(amount);
        attempt.setMethod(method.getCode());
        attempt.setStatus(PaymentAttempt.Status.PENDING);
        attempt.setCreatedAt(OffsetDateTime.now(clock));
        attempt = attempts.save(attempt);

        PaymentGateway.GatewayResponse response = callGateway(
                new PaymentGateway.Charge(bookingId, amount, method, attempt.getAttemptId()));

        attempt.setCompletedAt(OffsetDateTime.now(clock));
        attempt.setMessage(response.message());
        if (!response.success() || response.transactionId() == null || response.transactionId().isBlank()) {
            attempt.setStatus(PaymentAttempt.Status.FAILED);
            attempts.save(attempt);
            log.info("Payment failed: bookingId={}, attempt={}, reason={}", bookingId, attempt.getAttemptId(), response.message());
            return new PaymentResult(STATUS_FAILED, RETRY_MESSAGE, null);
        }

        // the loaded entity may be stale after the gateway wait, so only the payment columns are written
        if (bookings.markPaid(bookingId, response.transactionId(), OffsetDateTime.now(clock)) == 0) {
            attempt.setStatus(PaymentAttempt.Status.FAILED);
            attempt.setTransactionId(response.transactionId());
            attempt.setMessage("Booking removed during settlement");
            attempts.save(attempt);
            log.warn("Booking {} removed while payment was in flight: attempt={}, txn={}",
                    bookingId, attempt.getAttemptId(), response.transactionId());
            throw new NotFoundException("Booking not found");
        }

        attempt.setStatus(PaymentAttempt.Status.SUCCEEDED);
        attempt.setTransactionId(response.transactionId());
        attempts.save(attempt);
        log.info("Payment settled: bookingId={}, attempt={}, txn={}", bookingId, attempt.getAttemptId(), response.transactionId());
        return new PaymentResult(STATUS_SUCCESS,
                "Payment of $" + amount.toPlainString() + " processed via " + method.getCode()
                        + ". Transaction ID: " + response.transactionId(),
                response.transactionId());
    }

    private PaymentGateway.GatewayResponse callGateway(PaymentGateway.Charge charge) {
        try {
            PaymentGateway.GatewayResponse r = gateway.charge(charge).get(gatewayTimeoutMs, TimeUnit.MILLISECONDS);
            return r == null ? PaymentGateway.GatewayResponse.declined("Empty gateway response") : r;
        } catch (TimeoutException e) {
            log.warn("Payment gateway timed out after {}ms: bookingId={}", gatewayTimeoutMs, charge.bookingId());
            return PaymentGateway.GatewayResponse.declined("Gateway timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PaymentGateway.GatewayResponse.declined("Interrupted");
        } catch (ExecutionException e) {
            log.warn("Payment gateway error: bookingId={}, cause={}", charge.bookingId(), String.valueOf(e.getCause()));
            return PaymentGateway.GatewayResponse.declined("Gateway error");
        }
    }

    public List<PaymentAttempt> getAttempts(String bookingId) {
        return attempts.findByBookingIdOrderByCreatedAtAsc(bookingId);
    }
}

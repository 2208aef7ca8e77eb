package com.hotelbot.assistant.service;

import com.hotelbot.assistant.error.NotFoundException;
import com.hotelbot.assistant.error.ValidationException;
import com.hotelbot.assistant.model.Booking;
import com.hotelbot.assistant.model.PaymentAttempt;
import com.hotelbot.assistant.payment.PaymentGateway;
import com.hotelbot.assistant.repo.BookingRepository;
import com.hotelbot.assistant.repo.PaymentAttemptRepository;
import com.hotelbot.assistant.util.IdGenerator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class PaymentServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private BookingRepository bookings;
    private PaymentAttemptRepository attempts;
    private final AtomicInteger idSeq = new AtomicInteger();
    private final IdGenerator ids = () -> "attempt-" + idSeq.incrementAndGet();

    @BeforeEach
    public void setUp() {
        bookings = mock(BookingRepository.class);
        attempts = mock(PaymentAttemptRepository.class);
        when(attempts.save(any(PaymentAttempt.class))).thenAnswer(inv -> inv.getArgument(0));
        when(bookings.markPaid(anyString(), anyString(), any(OffsetDateTime.class))).thenReturn(1);
    }

    private PaymentService service(PaymentGateway gateway, long timeoutMs) {
        return new PaymentService(bookings, attempts, gateway, new KeyedLockService(), ids, CLOCK, timeoutMs, 5000);
    }

    @Test
    public void shouldMarkBookingPaidOnApproval() {
        Booking b = unpaid("BK-1");
        when(bookings.findById("BK-1")).thenReturn(Optional.of(b));
        PaymentService svc = service(c -> CompletableFuture.completedFuture(PaymentGateway.GatewayResponse.approved("TXN123")), 1000);

        PaymentService.PaymentResult result = svc.processPayment("BK-1", new BigDecimal("300"), "credit_card");

        Assertions.assertEquals("success", result.status());
        Assertions.assertEquals("TXN123", result.transactionId());
        Assertions.assertEquals("Payment of $300 processed via credit_card. Transaction ID: TXN123", result.message());
        verify(bookings).markPaid("BK-1", "TXN123", OffsetDateTime.now(CLOCK));
        verify(bookings, never()).save(any());

        ArgumentCaptor<PaymentAttempt> captor = ArgumentCaptor.forClass(PaymentAttempt.class);
        verify(attempts, atLeastOnce()).save(captor.capture());
        PaymentAttempt last = captor.getValue();
        Assertions.assertEquals(PaymentAttempt.Status.SUCCEEDED, last.getStatus());
        Assertions.assertEquals("credit_card", last.getMethod());
    }

    @Test
    public void shouldReportDeclineWithoutTouchingBooking() {
        Booking b = unpaid("BK-1");
        when(bookings.findById("BK-1")).thenReturn(Optional.of(b));
        PaymentService svc = service(c -> CompletableFuture.completedFuture(PaymentGateway.GatewayResponse.declined("no funds")), 1000);

        PaymentService.PaymentResult result = svc.processPayment("BK-1", new BigDecimal("300"), "paypal");

        Assertions.assertEquals("failed", result.status());
        Assertions.assertEquals(PaymentService.RETRY_MESSAGE, result.message());
        Assertions.assertNull(result.transactionId());
        verify(bookings, never()).markPaid(anyString(), anyString(), any());
        verify(bookings, never()).save(any());

        ArgumentCaptor<PaymentAttempt> captor = ArgumentCaptor.forClass(PaymentAttempt.class);
        verify(attempts, atLeastOnce()).save(captor.capture());
        Assertions.assertEquals(PaymentAttempt.Status.FAILED, captor.getValue().getStatus());
    }

    @Test
    public void shouldNotChargeAlreadyPaidBooking() {
        Booking b = unpaid("BK-1");
        b.setPaid(true);
        b.setTransactionId("TXN-OLD");
        when(bookings.findById("BK-1")).thenReturn(Optional.of(b));
        PaymentGateway gateway = mock(PaymentGateway.class);

        PaymentService.PaymentResult result = service(gateway, 1000).processPayment("BK-1", new BigDecimal("300"), "debit_card");

        Assertions.assertEquals("success", result.status());
        Assertions.assertEquals("TXN-OLD", result.transactionId());
        Assertions.assertTrue(b.isPaid());
        verifyNoInteractions(gateway);
        verify(attempts, never()).save(any());
    }

    @Test
    public void shouldRejectUnknownBooking() {
        when(bookings.findById("missing")).thenReturn(Optional.empty());
        PaymentGateway gateway = mock(PaymentGateway.class);

        Assertions.assertThrows(NotFoundException.class,
                () -> service(gateway, 1000).processPayment("missing", new BigDecimal("10"), "credit_card"));
        verifyNoInteractions(gateway);
    }

    @Test
    public void shouldRejectUnsupportedMethod() {
        PaymentGateway gateway = mock(PaymentGateway.class);

        Assertions.assertThrows(ValidationException.class,
                () -> service(gateway, 1000).processPayment("BK-1", new BigDecimal("10"), "bitcoin"));
        Assertions.assertThrows(ValidationException.class,
                () -> service(gateway, 1000).processPayment("BK-1", new BigDecimal("-1"), "paypal"));
        verifyNoInteractions(gateway, bookings);
    }

    @Test
    public void shouldTreatGatewayTimeoutAsFailure() {
        Booking b = unpaid("BK-1");
        when(bookings.findById("BK-1")).thenReturn(Optional.of(b));
        PaymentService svc = service(c -> new CompletableFuture<>(), 50);

        PaymentService.PaymentResult result = svc.processPayment("BK-1", new BigDecimal("300"), "credit_card");

        Assertions.assertEquals("failed", result.status());
        verify(bookings, never()).markPaid(anyString(), anyString(), any());
    }

    @Test
    public void shouldFailAttemptWhenBookingVanishesBeforeSettling() {
        when(bookings.findById("BK-1")).thenReturn(Optional.of(unpaid("BK-1")));
        when(bookings.markPaid(eq("BK-1"), anyString(), any(OffsetDateTime.class))).thenReturn(0);
        PaymentService svc = service(c -> CompletableFuture.completedFuture(PaymentGateway.GatewayResponse.approved("TXN9")), 1000);

        Assertions.assertThrows(NotFoundException.class,
                () -> svc.processPayment("BK-1", new BigDecimal("300"), "credit_card"));

        ArgumentCaptor<PaymentAttempt> captor = ArgumentCaptor.forClass(PaymentAttempt.class);
        verify(attempts, atLeastOnce()).save(captor.capture());
        Assertions.assertEquals(PaymentAttempt.Status.FAILED, captor.getValue().getStatus());
        Assertions.assertEquals("TXN9", captor.getValue().getTransactionId());
    }

    @Test
    public void shouldChargeOnceForConcurrentPayments() throws Exception {
        Booking b = unpaid("BK-1");
        when(bookings.findById("BK-1")).thenReturn(Optional.of(b));
        when(bookings.markPaid(eq("BK-1"), anyString(), any(OffsetDateTime.class))).thenAnswer(inv -> {
            b.setPaid(true);
            b.setTransactionId(inv.getArgument(1));
            return 1;
        });
        AtomicInteger charges = new AtomicInteger();
        PaymentService svc = service(c -> {
            charges.incrementAndGet();
            return CompletableFuture.supplyAsync(() -> PaymentGateway.GatewayResponse.approved("TXN-" + c.attemptId()),
                    CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));
        }, 2000);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<PaymentService.PaymentResult> f1 = pool.submit(() -> {
                start.await();
                return svc.processPayment("BK-1", new BigDecimal("300"), "credit_card");
            });
            Future<PaymentService.PaymentResult> f2 = pool.submit(() -> {
                start.await();
                return svc.processPayment("BK-1", new BigDecimal("300"), "credit_card");
            });
            start.countDown();
            List<PaymentService.PaymentResult> results = List.of(f1.get(5, TimeUnit.SECONDS), f2.get(5, TimeUnit.SECONDS));

            Assertions.assertEquals(1, charges.get());
            Assertions.assertTrue(results.stream().allMatch(PaymentService.PaymentResult::isSuccess));
            Assertions.assertEquals(results.get(0).transactionId(), results.get(1).transactionId());
        } finally {
            pool.shutdownNow();
        }
    }

    private static Booking unpaid(String id) {
        Booking b = new Booking();
        b.setBookingId(id);
        b.setUserId("user-1");
        b.setRoomId(1);
        b.setTotalAmount(new BigDecimal("300"));
        b.setPaid(false);
        return b;
    }
}

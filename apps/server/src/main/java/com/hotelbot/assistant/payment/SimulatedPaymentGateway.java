package com.hotelbot.assistant.payment;

import com.hotelbot.assistant.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Stand-in PSP: answers after a fixed latency and approves with a configured probability.
 */
@Component
public class SimulatedPaymentGateway implements PaymentGateway {
    private static final Logger log = LoggerFactory.getLogger(SimulatedPaymentGateway.class);

    private final IdGenerator ids;
    private final Random random;
    private final long latencyMs;
    private final double successRate;

    @Autowired
    public SimulatedPaymentGateway(IdGenerator ids,
                                   @Value("${payment.simulated.latencyMs:1000}") long latencyMs,
                                   @Value("${payment.simulated.successRate:0.9}") double successRate) {
        this(ids, new Random(), latencyMs, successRate);
    }

    public SimulatedPaymentGateway(IdGenerator ids, Random random, long latencyMs, double successRate) {
        this.ids = ids;
        this.random = random;
        this.latencyMs = Math.max(0, latencyMs);
        this.successRate = successRate;
    }

    @Override
    public CompletableFuture<GatewayResponse> charge(Charge charge) {
        return CompletableFuture.supplyAsync(() -> {
            boolean approved = random.nextDouble() < successRate;
            if (approved) {
                String txn = ids.newReference();
                log.info("[PSP] approved booking={} amount={} method={} txn={}",
                        charge.bookingId(), charge.amount(), charge.method().getCode(), txn);
                return GatewayResponse.approved(txn);
            }
            log.info("[PSP] declined booking={} amount={} method={}",
                    charge.bookingId(), charge.amount(), charge.method().getCode());
            return GatewayResponse.declined("Payment declined by gateway");
        }, CompletableFuture.delayedExecutor(latencyMs, TimeUnit.MILLISECONDS));
    }
}

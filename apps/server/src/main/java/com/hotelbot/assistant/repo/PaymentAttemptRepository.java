package com.hotelbot.assistant.repo;

import com.hotelbot.assistant.model.PaymentAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PaymentAttemptRepository extends JpaRepository<PaymentAttempt, String> {
    List<PaymentAttempt> findByBookingIdOrderByCreatedAtAsc(String bookingId);
}

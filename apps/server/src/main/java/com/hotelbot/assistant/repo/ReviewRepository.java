package com.hotelbot.assistant.repo;

import com.hotelbot.assistant.model.Review;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ReviewRepository extends JpaRepository<Review, String> {
    List<Review> findByBookingIdOrderByCreatedAtAsc(String bookingId);

    List<Review> findByUserIdOrderByCreatedAtAsc(String userId);
}
